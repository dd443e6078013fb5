package com.hhplus.storefront.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    @JsonProperty("cart_id")
    private Long cartId;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("total_quantity")
    private int totalQuantity;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("lines")
    private List<CartLineResponse> lines;
}
