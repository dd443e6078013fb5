package com.hhplus.storefront.application.payment.dto;

import java.util.Arrays;

/**
 * 게이트웨이 결제 상태
 *
 * - COMPLETED: 결제 완료
 * - PENDING, INITIATED: 진행 중 (주문 상태 유지)
 * - EXPIRED, USER_CANCELED, REFUNDED, PARTIALLY_REFUNDED, FAILED: 실패 확정 (주문 취소)
 * - UNKNOWN: 알 수 없는 값. 진행 중으로 취급한다.
 */
public enum PaymentGatewayStatus {
    COMPLETED("Completed"),
    PENDING("Pending"),
    INITIATED("Initiated"),
    EXPIRED("Expired"),
    USER_CANCELED("User canceled"),
    REFUNDED("Refunded"),
    PARTIALLY_REFUNDED("Partially Refunded"),
    FAILED("Failed"),
    UNKNOWN("Unknown");

    private final String gatewayValue;

    PaymentGatewayStatus(String gatewayValue) {
        this.gatewayValue = gatewayValue;
    }

    public String getGatewayValue() {
        return gatewayValue;
    }

    public static PaymentGatewayStatus fromGatewayValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
                .filter(status -> status.gatewayValue.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(UNKNOWN);
    }

    public boolean isCompleted() {
        return this == COMPLETED;
    }

    public boolean isFailure() {
        return this == EXPIRED || this == USER_CANCELED || this == REFUNDED
                || this == PARTIALLY_REFUNDED || this == FAILED;
    }
}
