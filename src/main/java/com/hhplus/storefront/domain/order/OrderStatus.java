package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.InvalidArgumentException;

/**
 * 주문 상태
 *
 * 어떤 상태 간 이동이 허용되는지는 OrderTransitionTable이 결정한다.
 * CONFIRMED, OUT_FOR_DELIVERY는 확장 정책에서만 사용된다.
 * DELIVERED, CANCELLED는 어떤 정책에서도 종료 상태다.
 */
public enum OrderStatus {
    PENDING("주문 접수"),
    CONFIRMED("주문 확인"),
    PROCESSING("상품 준비중"),
    PACKED("포장 완료"),
    SHIPPED("배송 시작"),
    OUT_FOR_DELIVERY("배송 출발"),
    DELIVERED("배송 완료"),
    CANCELLED("주문 취소");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * 문자열로부터 OrderStatus 조회 (대소문자 무시)
     */
    public static OrderStatus fromString(String value) {
        if (value == null) {
            throw new InvalidArgumentException("주문 상태 값이 비어 있습니다");
        }
        for (OrderStatus status : OrderStatus.values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new InvalidArgumentException("알 수 없는 주문 상태입니다: " + value);
    }
}
