package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 주문 항목이 참조 중인 상품을 삭제하려 할 때 발생하는 예외 (409)
 */
public class ProductInUseException extends DomainException {

    public ProductInUseException(Long productId) {
        super(ErrorCode.PRODUCT_IN_USE, "productId=" + productId);
    }
}
