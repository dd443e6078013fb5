package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;

/**
 * 결제 게이트웨이 응답 시간 초과 (504)
 * 주문 상태는 바뀌지 않으며 같은 요청을 다시 시도할 수 있다.
 */
public class PaymentGatewayTimeoutException extends SystemException {

    public PaymentGatewayTimeoutException(String operation, Throwable cause) {
        super(ErrorCode.PAYMENT_GATEWAY_TIMEOUT, "operation=" + operation, cause);
    }
}
