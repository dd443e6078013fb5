package com.hhplus.storefront.application.notification;

import com.hhplus.storefront.domain.notification.Severity;
import com.hhplus.storefront.domain.order.OrderStatus;

/**
 * 주문 알림 문구
 */
public final class OrderNotificationMessages {

    private OrderNotificationMessages() {
        throw new AssertionError("Cannot instantiate OrderNotificationMessages");
    }

    public static String statusChanged(Long orderId, OrderStatus status) {
        switch (status) {
            case PENDING:
                return String.format("주문 #%d이(가) 접수되었습니다.", orderId);
            case CONFIRMED:
                return String.format("주문 #%d이(가) 확정되었습니다.", orderId);
            case PROCESSING:
                return String.format("주문 #%d을(를) 준비하고 있습니다.", orderId);
            case PACKED:
                return String.format("주문 #%d의 포장이 완료되어 발송을 기다리고 있습니다.", orderId);
            case SHIPPED:
                return String.format("주문 #%d이(가) 발송되었습니다.", orderId);
            case OUT_FOR_DELIVERY:
                return String.format("주문 #%d이(가) 배송 중입니다.", orderId);
            case DELIVERED:
                return String.format("주문 #%d이(가) 배송 완료되었습니다. 이용해 주셔서 감사합니다!", orderId);
            case CANCELLED:
                return String.format("주문 #%d이(가) 취소되었습니다.", orderId);
            default:
                return String.format("주문 #%d의 상태가 %s(으)로 변경되었습니다.", orderId, status.getDisplayName());
        }
    }

    public static Severity statusSeverity(OrderStatus status) {
        if (status == OrderStatus.CANCELLED) {
            return Severity.WARNING;
        }
        return status == OrderStatus.DELIVERED || status == OrderStatus.PENDING ? Severity.SUCCESS : Severity.INFO;
    }

    public static String deleted(Long orderId) {
        return String.format("주문 #%d이(가) 스토어에 의해 취소되었습니다. 자세한 내용은 고객센터로 문의해 주세요.", orderId);
    }

    public static String paymentConfirmed(Long orderId) {
        return String.format("주문 #%d의 결제가 확인되었습니다. 감사합니다!", orderId);
    }

    public static String receiptConfirmed(Long userId, Long orderId) {
        return String.format("고객 %d님이 주문 #%d의 수령을 확인했습니다.", userId, orderId);
    }
}
