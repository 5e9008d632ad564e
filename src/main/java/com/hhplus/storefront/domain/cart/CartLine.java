package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.domain.catalog.Product;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 장바구니 화면용 항목 (조회 시점의 상품 정보로 계산)
 */
@Getter
public class CartLine {
    private final Product product;
    private final int quantity;
    private final BigDecimal subtotal;

    public CartLine(Product product, int quantity) {
        this.product = product;
        this.quantity = quantity;
        this.subtotal = product.priceFor(quantity);
    }
}
