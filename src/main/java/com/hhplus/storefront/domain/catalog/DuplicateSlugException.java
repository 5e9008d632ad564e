package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 이미 존재하는 슬러그로 카테고리/상품을 생성하려 할 때 발생하는 예외 (409)
 */
public class DuplicateSlugException extends DomainException {

    public DuplicateSlugException(String slug) {
        super(ErrorCode.DUPLICATE_SLUG, "slug=" + slug);
    }
}
