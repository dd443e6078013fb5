package com.hhplus.storefront.domain.order.event;

import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 결제 확인 이벤트
 */
@Getter
@ToString
public class OrderPaymentConfirmedEvent extends ApplicationEvent {

    private final Long orderId;
    private final Long userId;
    private final PaymentMethod paymentMethod;
    private final BigDecimal amount;
    private final LocalDateTime occurredAt;

    public OrderPaymentConfirmedEvent(Long orderId, Long userId, PaymentMethod paymentMethod, BigDecimal amount) {
        super(orderId);
        this.orderId = orderId;
        this.userId = userId;
        this.paymentMethod = paymentMethod;
        this.amount = amount;
        this.occurredAt = LocalDateTime.now();
    }
}
