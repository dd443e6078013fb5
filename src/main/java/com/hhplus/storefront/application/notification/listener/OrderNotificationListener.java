package com.hhplus.storefront.application.notification.listener;

import com.hhplus.storefront.application.notification.NotificationSink;
import com.hhplus.storefront.application.notification.OrderNotificationMessages;
import com.hhplus.storefront.domain.notification.Severity;
import com.hhplus.storefront.domain.order.event.OrderDeletedEvent;
import com.hhplus.storefront.domain.order.event.OrderPaymentConfirmedEvent;
import com.hhplus.storefront.domain.order.event.OrderReceiptConfirmedEvent;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * 주문 이벤트 → 사용자 알림
 *
 * 커밋된 변경에 대해서만 알림을 보낸다. (AFTER_COMMIT)
 * 알림 실패는 로그만 남기고 주문 처리에는 영향을 주지 않는다.
 */
@Slf4j
@Component
public class OrderNotificationListener {

    private final NotificationSink notificationSink;
    private final List<Long> operatorUserIds;

    public OrderNotificationListener(NotificationSink notificationSink,
                                     @Value("${storefront.notification.operator-user-ids:}") List<Long> operatorUserIds) {
        this.notificationSink = notificationSink;
        this.operatorUserIds = operatorUserIds == null ? List.of() : List.copyOf(operatorUserIds);
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleStatusChanged(OrderStatusChangedEvent event) {
        send(event.getUserId(),
                OrderNotificationMessages.statusChanged(event.getOrderId(), event.getNewStatus()),
                OrderNotificationMessages.statusSeverity(event.getNewStatus()),
                event.getOrderId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleDeleted(OrderDeletedEvent event) {
        send(event.getUserId(), OrderNotificationMessages.deleted(event.getOrderId()), Severity.WARNING,
                event.getOrderId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handlePaymentConfirmed(OrderPaymentConfirmedEvent event) {
        send(event.getUserId(), OrderNotificationMessages.paymentConfirmed(event.getOrderId()), Severity.SUCCESS,
                event.getOrderId());
    }

    /**
     * 수령 확인은 운영자에게 알린다.
     */
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleReceiptConfirmed(OrderReceiptConfirmedEvent event) {
        String message = OrderNotificationMessages.receiptConfirmed(event.getUserId(), event.getOrderId());
        if (operatorUserIds.isEmpty()) {
            log.info("[OrderNotificationListener] 수령 확인 알림 대상 운영자 없음: orderId={}", event.getOrderId());
            return;
        }
        for (Long operatorId : operatorUserIds) {
            send(operatorId, message, Severity.SUCCESS, event.getOrderId());
        }
    }

    private void send(Long userId, String message, Severity severity, Long orderId) {
        try {
            notificationSink.notify(userId, message, severity);
            log.debug("[OrderNotificationListener] 알림 전송: orderId={}, userId={}, severity={}", orderId, userId, severity);
        } catch (RuntimeException e) {
            log.error("[OrderNotificationListener] 알림 전송 실패: orderId={}, userId={}, reason={}",
                    orderId, userId, e.getMessage(), e);
        }
    }
}
