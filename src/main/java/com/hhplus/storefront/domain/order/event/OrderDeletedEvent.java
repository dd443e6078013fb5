package com.hhplus.storefront.domain.order.event;

import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 삭제 이벤트
 * 취소되지 않은 주문이 관리자에 의해 삭제되었을 때 발행된다.
 */
@Getter
@ToString
public class OrderDeletedEvent extends ApplicationEvent {

    private final Long orderId;
    private final Long userId;
    private final LocalDateTime occurredAt;

    public OrderDeletedEvent(Long orderId, Long userId) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.occurredAt = LocalDateTime.now();
    }
}
