package com.hhplus.storefront.application.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.OrderLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 주문 항목 응답 (스냅샷)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResponse {
    @JsonProperty("order_line_id")
    private Long orderLineId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("size_name")
    private String sizeName;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    public static OrderLineResponse from(OrderLine line) {
        return OrderLineResponse.builder()
                .orderLineId(line.getOrderLineId())
                .productId(line.getProductId())
                .productName(line.getProductName())
                .sizeId(line.getSizeId())
                .sizeName(line.getSizeName())
                .unitPrice(line.getUnitPrice())
                .quantity(line.getQuantity())
                .subtotal(line.getSubtotal())
                .build();
    }
}
