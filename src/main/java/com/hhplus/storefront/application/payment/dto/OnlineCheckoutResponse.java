package com.hhplus.storefront.application.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 온라인 결제 주문 응답
 * 클라이언트는 payment_url로 이동해 결제를 진행한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnlineCheckoutResponse {
    @JsonProperty("order")
    private OrderResponse order;

    @JsonProperty("payment_url")
    private String paymentUrl;

    @JsonProperty("transaction_ref")
    private String transactionRef;
}
