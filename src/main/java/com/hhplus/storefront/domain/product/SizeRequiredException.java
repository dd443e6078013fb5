package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 사이즈 구분 상품에 사이즈를 지정하지 않았을 때 발생하는 예외 (400)
 */
public class SizeRequiredException extends DomainException {

    private final Long productId;

    public SizeRequiredException(Long productId, String productName) {
        super(ErrorCode.SIZE_REQUIRED, "'" + productName + "' 상품의 사이즈를 선택해주세요 (productId=" + productId + ")");
        this.productId = productId;
    }

    public Long getProductId() {
        return productId;
    }
}
