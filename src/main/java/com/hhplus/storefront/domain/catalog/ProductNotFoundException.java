package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (Domain 계층)
 *
 * 역할:
 * - 상품이 존재하지 않거나 비활성(is_active=false) 상태인 경우 발생
 * - 장바구니 추가, 상세 조회, 결제 시 재확인 단계에서 사용
 * - HTTP 404 Not Found 응답으로 변환됨
 */
public class ProductNotFoundException extends DomainException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }

    public ProductNotFoundException(String slug) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "slug=" + slug);
        this.productId = null;
    }

    public Long getProductId() {
        return productId;
    }
}
