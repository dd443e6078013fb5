package com.hhplus.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_PRODUCT_INSUFFICIENT_STOCK, SYSTEM_PAYMENT_GATEWAY_TIMEOUT
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Common
    INVALID_ARGUMENT("DOMAIN_INVALID_ARGUMENT", "잘못된 입력값입니다", 400),

    // Product / Inventory Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_SIZE_NOT_FOUND("DOMAIN_PRODUCT_SIZE_NOT_FOUND", "상품 사이즈를 찾을 수 없습니다", 404),
    SIZE_REQUIRED("DOMAIN_PRODUCT_SIZE_REQUIRED", "사이즈를 선택해야 하는 상품입니다", 400),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 409),

    // Cart Domain
    CART_LINE_NOT_FOUND("DOMAIN_CART_LINE_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_LINE_CONFLICT("DOMAIN_CART_LINE_CONFLICT", "같은 상품이 동시에 장바구니에 추가되었습니다. 다시 시도해 주세요", 409),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_TRANSITION("DOMAIN_ORDER_INVALID_TRANSITION", "허용되지 않은 주문 상태 변경입니다", 409),
    INVALID_ORDER_STATE("DOMAIN_ORDER_INVALID_STATE", "현재 주문 상태에서 수행할 수 없는 작업입니다", 409),
    ORDER_NOT_CANCELLABLE("DOMAIN_ORDER_NOT_CANCELLABLE", "취소할 수 없는 주문입니다", 409),
    USER_MISMATCH("DOMAIN_ORDER_USER_MISMATCH", "주문 사용자가 일치하지 않습니다", 403),

    // Notification Domain
    USER_MESSAGE_NOT_FOUND("DOMAIN_USER_MESSAGE_NOT_FOUND", "메시지를 찾을 수 없습니다", 404),

    // ========== System Errors (5XX) ==========

    PAYMENT_GATEWAY_TIMEOUT("SYSTEM_PAYMENT_GATEWAY_TIMEOUT", "결제 게이트웨이 응답 시간이 초과되었습니다", 504),
    PAYMENT_GATEWAY_REJECTED("SYSTEM_PAYMENT_GATEWAY_REJECTED", "결제 게이트웨이가 요청을 거절했습니다", 502),
    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "재고 락 획득에 실패했습니다", 503),
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
