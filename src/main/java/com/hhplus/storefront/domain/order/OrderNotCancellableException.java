package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 취소 가능 시간 또는 상태 조건을 벗어난 취소 요청 (409)
 */
public class OrderNotCancellableException extends DomainException {

    private final Long orderId;
    private final OrderStatus currentStatus;

    public OrderNotCancellableException(Long orderId, OrderStatus currentStatus, String detail) {
        super(ErrorCode.ORDER_NOT_CANCELLABLE,
                String.format("orderId=%d, 현재 상태: %s, %s", orderId, currentStatus, detail));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
    }

    public Long getOrderId() {
        return orderId;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }
}
