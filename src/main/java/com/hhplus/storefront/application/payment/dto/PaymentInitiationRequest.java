package com.hhplus.storefront.application.payment.dto;

import com.hhplus.storefront.domain.order.CustomerInfo;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 결제 개시 요청
 * 금액은 모두 최소 화폐 단위(×100)로 변환되어 있다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentInitiationRequest {
    private String purchaseOrderId;
    private String purchaseOrderName;
    private long amountMinor;
    private String customerName;
    private String customerEmail;
    private String customerPhone;
    private List<LineItem> lineItems;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineItem {
        /** 상품 ID. 상품이 삭제된 항목은 "deleted" */
        private String identity;
        private String name;
        private long unitPriceMinor;
        private int quantity;
        private long totalPriceMinor;
    }

    public static PaymentInitiationRequest forOrder(Order order) {
        CustomerInfo customer = order.getCustomerInfo();
        List<LineItem> items = order.getOrderLines().stream()
                .map(PaymentInitiationRequest::toLineItem)
                .collect(Collectors.toList());

        return PaymentInitiationRequest.builder()
                .purchaseOrderId(String.valueOf(order.getOrderId()))
                .purchaseOrderName("Order #" + order.getOrderId())
                .amountMinor(toMinorUnits(order.getTotalAmount()))
                .customerName(customer.getFullName())
                .customerEmail(customer.getEmail())
                .customerPhone(customer.getPhone())
                .lineItems(items)
                .build();
    }

    public static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static LineItem toLineItem(OrderLine line) {
        return LineItem.builder()
                .identity(line.hasProductReference() ? String.valueOf(line.getProductId()) : "deleted")
                .name(line.getSizeName() == null ? line.getProductName()
                        : line.getProductName() + " (" + line.getSizeName() + ")")
                .unitPriceMinor(toMinorUnits(line.getUnitPrice()))
                .quantity(line.getQuantity())
                .totalPriceMinor(toMinorUnits(line.getSubtotal()))
                .build();
    }
}
