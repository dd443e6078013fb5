package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바로 구매 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyNowRequest {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("customer")
    private CustomerInfoRequest customer;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("order_notes")
    private String orderNotes;
}
