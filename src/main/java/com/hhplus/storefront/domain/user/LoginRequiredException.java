package com.hhplus.storefront.domain.user;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 로그인이 필요한 기능을 비로그인 상태로 호출했을 때 발생하는 예외 (401)
 */
public class LoginRequiredException extends DomainException {

    public LoginRequiredException() {
        super(ErrorCode.LOGIN_REQUIRED);
    }
}
