package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 현재 주문 상태/플래그로는 수행할 수 없는 작업 (409)
 * 예: 수령 확인 재요청, 배송 완료 전 수령 확인
 */
public class InvalidOrderStateException extends DomainException {

    public InvalidOrderStateException(Long orderId, String detail) {
        super(ErrorCode.INVALID_ORDER_STATE, "orderId=" + orderId + ", " + detail);
    }
}
