package com.hhplus.storefront.domain.order.event;

import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 고객 수령 확인 이벤트
 * 관리자에게 알림이 전달된다.
 */
@Getter
@ToString
public class OrderReceiptConfirmedEvent extends ApplicationEvent {

    private final Long orderId;
    private final Long userId;
    private final LocalDateTime receivedAt;

    public OrderReceiptConfirmedEvent(Long orderId, Long userId, LocalDateTime receivedAt) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.receivedAt = receivedAt;
    }
}
