package com.hhplus.storefront.application.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.CustomerInfo;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("order_status")
    private OrderStatus orderStatus;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("payment_confirmed")
    private boolean paymentConfirmed;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("email")
    private String email;

    @JsonProperty("phone")
    private String phone;

    @JsonProperty("shipping_address")
    private String shippingAddress;

    @JsonProperty("receiver_name")
    private String receiverName;

    @JsonProperty("receiver_phone")
    private String receiverPhone;

    @JsonProperty("order_notes")
    private String orderNotes;

    @JsonProperty("cancellation_reason")
    private String cancellationReason;

    @JsonProperty("received")
    private boolean received;

    @JsonProperty("received_at")
    private LocalDateTime receivedAt;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    @JsonProperty("order_lines")
    private List<OrderLineResponse> orderLines;

    public static OrderResponse from(Order order) {
        CustomerInfo customer = order.getCustomerInfo();
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .orderStatus(order.getOrderStatus())
                .paymentMethod(order.getPaymentMethod())
                .paymentConfirmed(order.isPaymentConfirmed())
                .totalAmount(order.getTotalAmount())
                .fullName(customer.getFullName())
                .email(customer.getEmail())
                .phone(customer.getPhone())
                .shippingAddress(formatAddress(customer))
                .receiverName(customer.getEffectiveReceiverName())
                .receiverPhone(customer.getEffectiveReceiverPhone())
                .orderNotes(order.getOrderNotes())
                .cancellationReason(order.getCancellationReason())
                .received(order.isReceived())
                .receivedAt(order.getReceivedAt())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .orderLines(order.getOrderLines().stream()
                        .map(OrderLineResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }

    private static String formatAddress(CustomerInfo customer) {
        StringBuilder sb = new StringBuilder(customer.getAddress()).append(", ").append(customer.getCity());
        if (customer.getState() != null && !customer.getState().isBlank()) {
            sb.append(", ").append(customer.getState());
        }
        if (customer.getPostalCode() != null && !customer.getPostalCode().isBlank()) {
            sb.append(" ").append(customer.getPostalCode());
        }
        return sb.toString();
    }
}
