package com.hhplus.storefront.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 상품 목록 응답 DTO
 *
 * 카테고리 목록과 현재 장바구니 수량(cart_count)을 함께 내려준다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {

    /**
     * 카테고리로 필터링한 경우에만 값이 있음
     */
    private CategoryResponse category;

    private List<CategoryResponse> categories;

    private List<ProductResponse> products;

    private String query;

    private String sort;

    @JsonProperty("cart_count")
    private long cartCount;
}
