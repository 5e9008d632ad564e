package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.domain.cart.CartLine;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 결과 (조회 시점의 상품 가격 기준)
 */
@Getter
public class CartView {
    private final List<CartLine> lines;
    private final long totalQuantity;
    private final BigDecimal totalAmount;

    public CartView(List<CartLine> lines) {
        this.lines = List.copyOf(lines);
        this.totalQuantity = lines.stream().mapToLong(CartLine::getQuantity).sum();
        this.totalAmount = lines.stream()
                .map(CartLine::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
