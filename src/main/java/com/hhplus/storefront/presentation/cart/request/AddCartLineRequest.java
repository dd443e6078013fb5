package com.hhplus.storefront.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 항목 추가 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartLineRequest {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("quantity")
    private int quantity;
}
