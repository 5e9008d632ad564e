package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.ValidationException;

/**
 * 장바구니 항목 수량이 허용 범위를 벗어난 경우 (400)
 */
public class InvalidQuantityException extends ValidationException {

    public InvalidQuantityException(long quantity) {
        super(String.format("quantity: %s (입력값: %d)", CartConstants.MSG_INVALID_QUANTITY_RANGE, quantity));
    }
}
