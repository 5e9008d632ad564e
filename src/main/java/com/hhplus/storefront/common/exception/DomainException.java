package com.hhplus.storefront.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 조회 실패, 입력값 검증 실패, 인증 실패 등 클라이언트 측 오류
 * - 일반적으로 4XX로 응답
 *
 * 사용 예:
 * - ProductNotFoundException: 상품 조회 실패 (또는 비활성 상품)
 * - EmptyCartException: 빈 장바구니로 결제 시도
 * - ValidationException: 필수 입력값 누락
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
