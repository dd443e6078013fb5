package com.hhplus.storefront.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 등록 Command
 * 사이즈 구분 상품은 initialStock 0으로 등록한 뒤 사이즈별 재고를 추가한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterProductCommand {
    private String productName;
    private String description;
    private BigDecimal price;
    private int initialStock;
}
