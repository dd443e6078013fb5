package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 같은 (장바구니, 상품, 사이즈) 항목이 동시에 생성되어 유일 키에 걸렸을 때 (409)
 */
public class CartLineConflictException extends DomainException {

    public CartLineConflictException(Long cartId, Long productId, Long sizeId, Throwable cause) {
        super(ErrorCode.CART_LINE_CONFLICT, "cartId=" + cartId + ", productId=" + productId + ", sizeId=" + sizeId, cause);
    }
}
