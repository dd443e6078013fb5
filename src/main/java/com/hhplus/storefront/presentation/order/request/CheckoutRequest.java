package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 결제 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    @JsonProperty("customer")
    private CustomerInfoRequest customer;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("order_notes")
    private String orderNotes;
}
