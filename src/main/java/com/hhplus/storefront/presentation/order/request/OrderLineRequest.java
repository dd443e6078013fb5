package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineRequest {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("quantity")
    private int quantity;
}
