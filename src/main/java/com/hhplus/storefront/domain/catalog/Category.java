package com.hhplus.storefront.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

/**
 * Category 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 이름과 슬러그는 각각 유일
 * - 생성 이후 변경하지 않음
 * - 카테고리 삭제 시 소속 상품도 함께 삭제됨 (products.category_id ON DELETE CASCADE)
 */
@Entity
@Table(name = "categories", uniqueConstraints = {
    @UniqueConstraint(name = "uk_categories_name", columnNames = "name"),
    @UniqueConstraint(name = "uk_categories_slug", columnNames = "slug")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "category_id")
    private Long categoryId;

    @Column(name = "name", nullable = false, length = 60)
    private String name;

    @Column(name = "slug", nullable = false, length = 60)
    private String slug;

    /**
     * 카테고리 생성 팩토리 메서드
     */
    public static Category create(String name, String slug) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("카테고리명은 필수입니다");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("슬러그는 필수입니다");
        }
        return Category.builder()
                .name(name.trim())
                .slug(slug.trim())
                .build();
    }
}
