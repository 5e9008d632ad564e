package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 결제 화면 초기값 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutFormResponse {

    @JsonProperty("full_name")
    private String fullName;

    private String email;

    @JsonProperty("cart_count")
    private long cartCount;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;
}
