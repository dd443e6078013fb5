package com.hhplus.storefront.application.cart.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 항목 응답
 * unit_price는 조회 시점의 상품 가격이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineResponse {
    @JsonProperty("cart_line_id")
    private Long cartLineId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("size_id")
    private Long sizeId;

    @JsonProperty("size_name")
    private String sizeName;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    public static CartLineResponse from(CartLine line, Product product, String sizeName) {
        return CartLineResponse.builder()
                .cartLineId(line.getCartLineId())
                .productId(line.getProductId())
                .productName(product.getProductName())
                .sizeId(line.getSizeId())
                .sizeName(sizeName)
                .quantity(line.getQuantity())
                .unitPrice(product.getPrice())
                .subtotal(product.getPrice().multiply(BigDecimal.valueOf(line.getQuantity())))
                .build();
    }
}
