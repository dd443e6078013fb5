package com.hhplus.storefront.application.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 검증 결과
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentVerificationResult {

    public enum Outcome {
        /** 결제 확인 완료 */
        VERIFIED,
        /** 이미 결제 확인된 주문 */
        ALREADY_VERIFIED,
        /** 게이트웨이 처리 중, 주문 변경 없음 */
        PENDING,
        /** 결제 실패로 주문 취소 */
        CANCELLED
    }

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("outcome")
    private Outcome outcome;

    @JsonProperty("order_status")
    private OrderStatus orderStatus;

    @JsonProperty("payment_confirmed")
    private boolean paymentConfirmed;

    @JsonProperty("gateway_status")
    private PaymentGatewayStatus gatewayStatus;

    @JsonProperty("reason")
    private String reason;

    public static PaymentVerificationResult of(Order order, Outcome outcome, PaymentGatewayStatus gatewayStatus, String reason) {
        return PaymentVerificationResult.builder()
                .orderId(order.getOrderId())
                .outcome(outcome)
                .orderStatus(order.getOrderStatus())
                .paymentConfirmed(order.isPaymentConfirmed())
                .gatewayStatus(gatewayStatus)
                .reason(reason)
                .build();
    }
}
