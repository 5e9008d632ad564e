package com.hhplus.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_PRODUCT_NOT_FOUND, APP_CHECKOUT_LOCK_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Catalog Domain
    CATEGORY_NOT_FOUND("DOMAIN_CATEGORY_NOT_FOUND", "카테고리를 찾을 수 없습니다", 404),
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_IN_USE("DOMAIN_PRODUCT_IN_USE", "주문 내역이 있는 상품은 삭제할 수 없습니다", 409),
    DUPLICATE_SLUG("DOMAIN_CATALOG_DUPLICATE_SLUG", "이미 사용 중인 슬러그입니다", 409),

    // Cart Domain
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),

    // Validation
    VALIDATION_FAILED("DOMAIN_VALIDATION_FAILED", "입력값이 올바르지 않습니다", 400),

    // Auth Domain
    AUTHENTICATION_FAILED("DOMAIN_AUTH_FAILED", "아이디 또는 비밀번호가 올바르지 않습니다", 401),
    LOGIN_REQUIRED("DOMAIN_AUTH_LOGIN_REQUIRED", "로그인이 필요합니다", 401),

    // ========== Application Layer Errors (5XX) ==========

    CHECKOUT_LOCK_FAILED("APP_CHECKOUT_LOCK_FAILED", "주문 처리 중입니다. 잠시 후 다시 시도해주세요", 503),

    // ========== System Errors (5XX) ==========

    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
