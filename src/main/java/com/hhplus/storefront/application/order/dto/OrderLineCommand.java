package com.hhplus.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 Command
 * sizeId는 사이즈 구분 상품일 때만 지정한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineCommand {
    private Long productId;
    private Long sizeId;
    private int quantity;
}
