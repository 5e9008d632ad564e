package com.hhplus.storefront.domain.user;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 로그인 실패 예외 (401)
 *
 * 아이디가 없는 경우와 비밀번호가 틀린 경우를 구분하지 않고 같은 메시지로 응답한다.
 */
public class AuthenticationFailedException extends DomainException {

    public AuthenticationFailedException() {
        super(ErrorCode.AUTHENTICATION_FAILED);
    }
}
