package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 빈 장바구니로 결제를 시도할 때 발생하는 예외 (400)
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException() {
        super(ErrorCode.CART_EMPTY);
    }
}
