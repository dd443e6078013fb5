package com.hhplus.storefront.application.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.product.ProductSize;
import com.hhplus.storefront.domain.product.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 사이즈별 재고 View
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SizeInventoryView {
    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("size_name")
    private String sizeName;

    @JsonProperty("sort_order")
    private Integer sortOrder;

    @JsonProperty("stock")
    private Integer stock;

    public static SizeInventoryView from(ProductSize productSize, Size size) {
        return SizeInventoryView.builder()
                .sizeId(productSize.getSizeId())
                .sizeName(size != null ? size.getName() : null)
                .sortOrder(size != null ? size.getSortOrder() : Integer.MAX_VALUE)
                .stock(productSize.getStock())
                .build();
    }
}
