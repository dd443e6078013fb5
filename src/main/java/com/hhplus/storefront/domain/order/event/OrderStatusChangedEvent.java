package com.hhplus.storefront.domain.order.event;

import com.hhplus.storefront.domain.order.OrderStatus;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이벤트
 * 상태 전이가 커밋된 뒤 고객 알림에 사용된다.
 */
@Getter
@ToString
public class OrderStatusChangedEvent extends ApplicationEvent {

    private final Long orderId;
    private final Long userId;
    private final OrderStatus previousStatus;
    private final OrderStatus newStatus;
    private final String reason;
    private final LocalDateTime occurredAt;

    public OrderStatusChangedEvent(Long orderId, Long userId, OrderStatus previousStatus,
                                   OrderStatus newStatus, String reason) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.reason = reason;
        this.occurredAt = LocalDateTime.now();
    }
}
