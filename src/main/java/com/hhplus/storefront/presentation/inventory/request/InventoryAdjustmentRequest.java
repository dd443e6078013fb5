package com.hhplus.storefront.presentation.inventory.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 재고 조정 요청 DTO (예약/반환 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryAdjustmentRequest {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("quantity")
    private int quantity;
}
