package com.hhplus.storefront.domain.catalog;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 정보 및 판매 상태(is_active) 관리
 * - 가격 변경, 재고 증감
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0 이상 (소수점 2자리 고정)
 * - 재고는 음수가 될 수 없음. 주문 시 차감은 0에서 멈춘다 (예약/백오더 없음)
 * - 비활성 상품은 목록, 상세, 장바구니, 결제 어디에서도 보이지 않음
 */
@Entity
@Table(name = "products",
    uniqueConstraints = @UniqueConstraint(name = "uk_products_slug", columnNames = "slug"),
    indexes = @Index(name = "idx_products_category_active", columnList = "category_id, is_active"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "category_id", nullable = false,
        foreignKey = @ForeignKey(name = "fk_products_category"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Category category;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "slug", nullable = false, length = 120)
    private String slug;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 카테고리, 상품명, 슬러그는 필수
     * - 가격 >= 0, 재고 >= 0
     * - 초기 상태는 판매 중(active)
     */
    public static Product create(Category category, String name, String slug, String description,
                                 BigDecimal price, int stock) {
        if (category == null) {
            throw new IllegalArgumentException("카테고리는 필수입니다");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("슬러그는 필수입니다");
        }
        validatePrice(price);
        if (stock < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .category(category)
                .name(name.trim())
                .slug(slug.trim())
                .description(description == null ? "" : description)
                .price(price)
                .stock(stock)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 판매 가능 여부 (카탈로그/장바구니/결제 노출 기준)
     */
    public boolean isAvailable() {
        return this.active;
    }

    /**
     * 수량에 대한 소계 (현재 가격 기준)
     */
    public BigDecimal priceFor(int quantity) {
        return this.price.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * 주문 시 재고 차감
     *
     * 비즈니스 규칙:
     * - 재고가 부족해도 실패하지 않고 0에서 멈춘다 (soft decrement)
     *
     * @param quantity 주문 수량 (1 이상)
     */
    public void decreaseStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("차감 수량은 0보다 커야 합니다");
        }
        this.stock = Math.max(0, this.stock - quantity);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 재고 입고
     */
    public void restock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("입고 수량은 0보다 커야 합니다");
        }
        if (quantity > Integer.MAX_VALUE - this.stock) {
            throw new IllegalArgumentException("재고가 허용 범위를 넘습니다");
        }
        this.stock += quantity;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 가격 변경
     *
     * 이미 생성된 주문 항목의 가격(스냅샷)에는 영향이 없다.
     */
    public void changePrice(BigDecimal newPrice) {
        validatePrice(newPrice);
        this.price = newPrice;
        this.updatedAt = LocalDateTime.now();
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }

    public void activate() {
        this.active = true;
        this.updatedAt = LocalDateTime.now();
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        if (price.scale() > 2) {
            throw new IllegalArgumentException("가격은 소수점 둘째 자리까지만 허용됩니다");
        }
    }
}
