package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외 (404)
 * 다른 사용자의 장바구니 항목을 지정한 경우에도 동일하게 처리한다.
 */
public class CartLineNotFoundException extends DomainException {

    public CartLineNotFoundException(Long cartLineId) {
        super(ErrorCode.CART_LINE_NOT_FOUND, "cartLineId=" + cartLineId);
    }
}
