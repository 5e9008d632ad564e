package com.hhplus.storefront.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 처리 실패 예외
 *
 * 도메인 규칙은 만족하지만 처리 과정이 실패한 경우 (예: 재시도 후에도 행 잠금 획득 실패).
 * 서버 오류(5XX)로 응답한다.
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
