package com.hhplus.storefront.presentation.common;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.ValidationException;
import com.hhplus.storefront.domain.catalog.ProductInUseException;
import com.hhplus.storefront.presentation.common.response.ErrorResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobalExceptionHandler 단위 테스트")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("도메인 예외 - ErrorCode의 상태 코드와 코드 문자열")
    void testHandleBizException() {
        ResponseEntity<ErrorResponse> response = handler.handleBizException(new ProductInUseException(3L));

        assertEquals(409, response.getStatusCode().value());
        assertEquals("DOMAIN_PRODUCT_IN_USE", response.getBody().getErrorCode());
        assertTrue(response.getBody().getErrors().isEmpty());
        assertTrue(response.getBody().getRequestId().startsWith("req-"));
    }

    @Test
    @DisplayName("잠금 재시도 초과 - 503")
    void testHandleLockFailure() {
        ResponseEntity<ErrorResponse> response = handler.handleBizException(
                new ApplicationException(ErrorCode.CHECKOUT_LOCK_FAILED, new RuntimeException("lock wait timeout")));

        assertEquals(503, response.getStatusCode().value());
        assertEquals("APP_CHECKOUT_LOCK_FAILED", response.getBody().getErrorCode());
    }

    @Test
    @DisplayName("검증 실패 - 400과 오류 목록")
    void testHandleValidationException() {
        ResponseEntity<ErrorResponse> response = handler.handleValidationException(
                new ValidationException(List.of("full_name: 필수 입력값입니다", "city: 필수 입력값입니다")));

        assertEquals(400, response.getStatusCode().value());
        assertEquals(List.of("full_name: 필수 입력값입니다", "city: 필수 입력값입니다"), response.getBody().getErrors());
    }

    @Test
    @DisplayName("처리되지 않은 예외 - 500과 일반 메시지")
    void testHandleGenericException() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(new IllegalStateException("boom"));

        assertEquals(500, response.getStatusCode().value());
        assertEquals("SYSTEM_INTERNAL_SERVER_ERROR", response.getBody().getErrorCode());
        assertEquals(ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), response.getBody().getErrorMessage());
    }
}
