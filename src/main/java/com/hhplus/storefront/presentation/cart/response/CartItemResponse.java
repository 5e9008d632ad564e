package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.cart.CartLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("product_slug")
    private String productSlug;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    private Integer quantity;

    private BigDecimal subtotal;

    public static CartItemResponse from(CartLine line) {
        return CartItemResponse.builder()
                .productId(line.getProduct().getProductId())
                .productName(line.getProduct().getName())
                .productSlug(line.getProduct().getSlug())
                .unitPrice(line.getProduct().getPrice())
                .quantity(line.getQuantity())
                .subtotal(line.getSubtotal())
                .build();
    }
}
