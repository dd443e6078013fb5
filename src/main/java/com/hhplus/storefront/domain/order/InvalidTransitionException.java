package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 전이표에 없는 상태 변경을 시도했을 때 발생하는 예외 (409)
 */
public class InvalidTransitionException extends DomainException {

    private final Long orderId;
    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;

    public InvalidTransitionException(Long orderId, OrderStatus currentStatus, OrderStatus requestedStatus) {
        super(ErrorCode.INVALID_ORDER_TRANSITION,
                String.format("orderId=%d, %s → %s", orderId, currentStatus, requestedStatus));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public Long getOrderId() {
        return orderId;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }

    public OrderStatus getRequestedStatus() {
        return requestedStatus;
    }
}
