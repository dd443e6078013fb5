package com.hhplus.storefront.config;

import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.CustomerInfoCommand;
import com.hhplus.storefront.application.order.dto.OrderLineCommand;
import com.hhplus.storefront.domain.order.PaymentMethod;

import java.util.List;

/**
 * 테스트 데이터 생성 헬퍼
 */
public final class TestDataFactory {

    private TestDataFactory() {
    }

    public static CustomerInfoCommand customer() {
        return CustomerInfoCommand.builder()
                .fullName("김하나")
                .email("hana@example.com")
                .phone("010-1234-5678")
                .address("테헤란로 123")
                .city("서울")
                .state("강남구")
                .postalCode("06236")
                .build();
    }

    public static CustomerInfoCommand customerWithoutEmail() {
        return CustomerInfoCommand.builder()
                .fullName("김하나")
                .phone("010-1234-5678")
                .address("테헤란로 123")
                .city("서울")
                .build();
    }

    public static OrderLineCommand line(Long productId, int quantity) {
        return line(productId, null, quantity);
    }

    public static OrderLineCommand line(Long productId, Long sizeId, int quantity) {
        return OrderLineCommand.builder()
                .productId(productId)
                .sizeId(sizeId)
                .quantity(quantity)
                .build();
    }

    public static CreateOrderCommand order(PaymentMethod paymentMethod, OrderLineCommand... lines) {
        return CreateOrderCommand.builder()
                .customer(customer())
                .lines(List.of(lines))
                .paymentMethod(paymentMethod)
                .build();
    }

    public static CreateOrderCommand codOrder(OrderLineCommand... lines) {
        return order(PaymentMethod.CASH_ON_DELIVERY, lines);
    }
}
