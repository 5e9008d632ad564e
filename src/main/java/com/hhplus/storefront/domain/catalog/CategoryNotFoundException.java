package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 카테고리를 찾을 수 없을 때 발생하는 예외 (404)
 */
public class CategoryNotFoundException extends DomainException {

    public CategoryNotFoundException(String slug) {
        super(ErrorCode.CATEGORY_NOT_FOUND, "slug=" + slug);
    }
}
