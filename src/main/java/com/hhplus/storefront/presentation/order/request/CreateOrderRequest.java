package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 생성 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    @JsonProperty("customer")
    private CustomerInfoRequest customer;

    @JsonProperty("lines")
    private List<OrderLineRequest> lines;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("order_notes")
    private String orderNotes;
}
