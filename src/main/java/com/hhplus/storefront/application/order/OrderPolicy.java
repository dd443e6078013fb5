package com.hhplus.storefront.application.order;

import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderTransitionTable;

import java.time.Duration;

/**
 * 주문 운영 정책
 *
 * - transitionTable: 사용할 상태 전이표 (standard / extended)
 * - customerCancelWindow: 고객이 직접 취소할 수 있는 주문 후 경과 시간
 *
 * 값은 OrderPolicyConfig에서 설정값으로 만들어 주입된다.
 */
public class OrderPolicy {

    private final OrderTransitionTable transitionTable;
    private final Duration customerCancelWindow;

    public OrderPolicy(OrderTransitionTable transitionTable, Duration customerCancelWindow) {
        if (transitionTable == null) {
            throw new IllegalArgumentException("transitionTable must not be null");
        }
        if (customerCancelWindow == null || customerCancelWindow.isNegative()) {
            throw new IllegalArgumentException("customerCancelWindow must not be negative: " + customerCancelWindow);
        }
        this.transitionTable = transitionTable;
        this.customerCancelWindow = customerCancelWindow;
    }

    public static OrderPolicy defaults() {
        return new OrderPolicy(OrderTransitionTable.standard(),
                Duration.ofMinutes(OrderConstants.DEFAULT_CUSTOMER_CANCEL_WINDOW_MINUTES));
    }

    public OrderTransitionTable getTransitionTable() {
        return transitionTable;
    }

    public Duration getCustomerCancelWindow() {
        return customerCancelWindow;
    }
}
