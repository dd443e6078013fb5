package com.hhplus.storefront.presentation.order.mapper;

import com.hhplus.storefront.application.order.dto.BuyNowCommand;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.CustomerInfoCommand;
import com.hhplus.storefront.application.order.dto.OrderLineCommand;
import com.hhplus.storefront.presentation.order.request.BuyNowRequest;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.request.CreateOrderRequest;
import com.hhplus.storefront.presentation.order.request.CustomerInfoRequest;
import com.hhplus.storefront.presentation.order.request.OrderLineRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation Request → Application Command 변환
 */
@Component
public class OrderMapper {

    public CreateOrderCommand toCreateOrderCommand(CreateOrderRequest request) {
        List<OrderLineCommand> lines = request.getLines() == null ? List.of()
                : request.getLines().stream()
                        .map(this::toOrderLineCommand)
                        .collect(Collectors.toList());
        return CreateOrderCommand.builder()
                .customer(toCustomerInfoCommand(request.getCustomer()))
                .lines(lines)
                .paymentMethod(request.getPaymentMethod())
                .orderNotes(request.getOrderNotes())
                .build();
    }

    public CheckoutCommand toCheckoutCommand(CheckoutRequest request) {
        return CheckoutCommand.builder()
                .customer(toCustomerInfoCommand(request.getCustomer()))
                .paymentMethod(request.getPaymentMethod())
                .orderNotes(request.getOrderNotes())
                .build();
    }

    public BuyNowCommand toBuyNowCommand(BuyNowRequest request) {
        return BuyNowCommand.builder()
                .productId(request.getProductId())
                .sizeId(request.getSizeId())
                .quantity(request.getQuantity())
                .customer(toCustomerInfoCommand(request.getCustomer()))
                .paymentMethod(request.getPaymentMethod())
                .orderNotes(request.getOrderNotes())
                .build();
    }

    private OrderLineCommand toOrderLineCommand(OrderLineRequest request) {
        return OrderLineCommand.builder()
                .productId(request.getProductId())
                .sizeId(request.getSizeId())
                .quantity(request.getQuantity())
                .build();
    }

    private CustomerInfoCommand toCustomerInfoCommand(CustomerInfoRequest request) {
        if (request == null) {
            return null;
        }
        return CustomerInfoCommand.builder()
                .fullName(request.getFullName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .address(request.getAddress())
                .city(request.getCity())
                .state(request.getState())
                .postalCode(request.getPostalCode())
                .receiverName(request.getReceiverName())
                .receiverPhone(request.getReceiverPhone())
                .build();
    }
}
