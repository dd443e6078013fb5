package com.hhplus.storefront.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 가격 변경 요청 DTO
 * 이미 생성된 주문의 단가에는 영향을 주지 않는다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ChangePriceRequest {
    @JsonProperty("price")
    private BigDecimal price;
}
