package com.hhplus.storefront.application.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * 상품 재고 현황 응답
 * 사이즈 구분 상품은 sizes에 파티션별 재고가, total_stock에 합계가 담긴다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("size_partitioned")
    private boolean sizePartitioned;

    @JsonProperty("total_stock")
    private Integer totalStock;

    @JsonProperty("sizes")
    private List<SizeInventoryView> sizes;

    public static InventoryResponse unpartitioned(Product product, int stock) {
        return InventoryResponse.builder()
                .productId(product.getProductId())
                .productName(product.getProductName())
                .sizePartitioned(false)
                .totalStock(stock)
                .sizes(Collections.emptyList())
                .build();
    }

    public static InventoryResponse partitioned(Product product, List<SizeInventoryView> sizes) {
        return InventoryResponse.builder()
                .productId(product.getProductId())
                .productName(product.getProductName())
                .sizePartitioned(true)
                .totalStock(sizes.stream().mapToInt(SizeInventoryView::getStock).sum())
                .sizes(sizes)
                .build();
    }
}
