package com.hhplus.storefront.presentation.cart.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 수량 변경 요청 DTO
 * qty가 없으면 1로 처리, 0 이하이면 항목 제거
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCartRequest {
    private Integer qty;

    public int qtyOrDefault() {
        return qty == null ? 1 : qty;
    }
}
