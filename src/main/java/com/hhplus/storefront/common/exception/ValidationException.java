package com.hhplus.storefront.common.exception;

import java.util.List;

/**
 * 입력값 검증 실패 예외
 *
 * 누락되었거나 잘못된 필드 목록을 함께 전달한다.
 * 예: 결제 연락처 필수값 누락, 회원가입 비밀번호 불일치, 중복 아이디/이메일
 */
public class ValidationException extends DomainException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(ErrorCode.VALIDATION_FAILED, String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
