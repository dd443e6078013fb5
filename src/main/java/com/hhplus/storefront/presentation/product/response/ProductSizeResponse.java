package com.hhplus.storefront.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.product.ProductSize;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProductSizeResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("stock")
    private Integer stock;

    public static ProductSizeResponse from(ProductSize productSize) {
        return new ProductSizeResponse(productSize.getProductId(), productSize.getSizeId(), productSize.getStock());
    }
}
