package com.hhplus.storefront.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AddProductSizeRequest {
    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("initial_stock")
    private int initialStock;
}
