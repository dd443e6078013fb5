package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품에 해당 사이즈 재고 파티션이 없을 때 발생하는 예외 (404)
 */
public class ProductSizeNotFoundException extends DomainException {

    public ProductSizeNotFoundException(Long productId, Long sizeId) {
        super(ErrorCode.PRODUCT_SIZE_NOT_FOUND, "productId=" + productId + ", sizeId=" + sizeId);
    }
}
