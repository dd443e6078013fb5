package com.hhplus.storefront.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 수량 변경 결과
 *
 * 요청 수량이 가용 재고를 넘으면 가용 재고로 맞추고 clamped=true로 알린다. (부분 성공)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineUpdateResult {
    @JsonProperty("line")
    private CartLineResponse line;

    @JsonProperty("requested_quantity")
    private int requestedQuantity;

    @JsonProperty("applied_quantity")
    private int appliedQuantity;

    @JsonProperty("clamped")
    private boolean clamped;
}
