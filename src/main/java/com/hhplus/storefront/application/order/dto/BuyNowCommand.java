package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바로 구매 Command
 * 장바구니를 거치지 않는 단일 항목 주문
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuyNowCommand {
    private Long productId;
    private Long sizeId;
    private int quantity;
    private CustomerInfoCommand customer;
    private PaymentMethod paymentMethod;
    private String orderNotes;

    public CreateOrderCommand toCreateOrderCommand() {
        return CreateOrderCommand.builder()
                .customer(customer)
                .lines(java.util.List.of(OrderLineCommand.builder()
                        .productId(productId)
                        .sizeId(sizeId)
                        .quantity(quantity)
                        .build()))
                .paymentMethod(paymentMethod)
                .orderNotes(orderNotes)
                .build();
    }
}
