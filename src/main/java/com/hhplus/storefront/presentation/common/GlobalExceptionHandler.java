package com.hhplus.storefront.presentation.common;

import com.hhplus.storefront.common.exception.BizException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.ValidationException;
import com.hhplus.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_VALIDATION_FAILED",
 *   "error_message": "입력값이 올바르지 않습니다",
 *   "errors": ["full_name: 필수 입력값입니다"],
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 코드 (404, 400, 401, 409, 503)
 * - 요청 형식 오류: 400
 * - 그 외: 500
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 입력값 검증 실패 (400) - 필드별 오류 목록 포함
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getErrorCode(), e.getErrors()));
    }

    /**
     * 비즈니스 예외 (NotFound, EmptyCart, 인증 실패 등)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] {} - {}", e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.debug("[GlobalExceptionHandler] {} - {}", e.getErrorCodeValue(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getErrorCode()));
    }

    /**
     * 요청 DTO Bean Validation 실패 (400)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorCode.VALIDATION_FAILED, errors));
    }

    /**
     * 본문 파싱 실패, 경로 변수 타입 불일치, 도메인 규칙 위반 인자 (400)
     */
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorCode.VALIDATION_FAILED, List.of(e.getMessage() == null ? "" : e.getMessage())));
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        return ResponseEntity.internalServerError()
                .body(ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR));
    }
}
