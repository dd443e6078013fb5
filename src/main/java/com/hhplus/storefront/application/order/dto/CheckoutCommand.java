package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 결제 Command
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutCommand {
    private CustomerInfoCommand customer;
    private PaymentMethod paymentMethod;
    private String orderNotes;
}
