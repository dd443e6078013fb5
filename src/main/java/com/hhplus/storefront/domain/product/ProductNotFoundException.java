package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외 (404)
 */
public class ProductNotFoundException extends DomainException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }

    public Long getProductId() {
        return productId;
    }
}
