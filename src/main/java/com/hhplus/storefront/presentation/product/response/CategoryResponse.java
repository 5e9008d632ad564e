package com.hhplus.storefront.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.catalog.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 카테고리 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryResponse {

    @JsonProperty("category_id")
    private Long categoryId;

    private String name;

    private String slug;

    public static CategoryResponse from(Category category) {
        return CategoryResponse.builder()
                .categoryId(category.getCategoryId())
                .name(category.getName())
                .slug(category.getSlug())
                .build();
    }
}
