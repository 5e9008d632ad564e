package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 주문이 없거나 다른 사용자의 주문일 때 발생하는 예외 (404)
 * 다른 사용자의 주문도 존재하지 않는 주문과 동일하게 취급한다.
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
