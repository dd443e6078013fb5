package com.hhplus.storefront.application.order.dto;

import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 생성 Command
 * 장바구니 결제와 바로 구매 모두 이 Command로 변환되어 같은 경로를 탄다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {
    private CustomerInfoCommand customer;
    private List<OrderLineCommand> lines;
    private PaymentMethod paymentMethod;
    private String orderNotes;
}
