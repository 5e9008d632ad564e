package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.application.cart.CartView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    private List<CartItemResponse> items;

    @JsonProperty("total_quantity")
    private long totalQuantity;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    public static CartResponse from(CartView view) {
        return CartResponse.builder()
                .items(view.getLines().stream()
                        .map(CartItemResponse::from)
                        .collect(Collectors.toList()))
                .totalQuantity(view.getTotalQuantity())
                .totalAmount(view.getTotalAmount())
                .build();
    }
}
