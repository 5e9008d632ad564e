package com.hhplus.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 결제 화면 초기값 (로그인 사용자 정보 + 장바구니 요약)
 */
@Getter
@Builder
@AllArgsConstructor
public class CheckoutForm {
    private final String fullName;
    private final String email;
    private final long cartCount;
    private final BigDecimal totalAmount;
}
