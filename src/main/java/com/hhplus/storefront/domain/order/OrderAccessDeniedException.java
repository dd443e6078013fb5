package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 다른 사용자의 주문에 접근했을 때 발생하는 예외 (403)
 */
public class OrderAccessDeniedException extends DomainException {

    public OrderAccessDeniedException(Long orderId, Long userId) {
        super(ErrorCode.USER_MISMATCH, "orderId=" + orderId + ", userId=" + userId);
    }
}
