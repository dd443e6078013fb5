package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;

/**
 * 결제 게이트웨이 거절/통신 오류 (502)
 */
public class PaymentGatewayRejectedException extends SystemException {

    private final Integer remoteStatus;

    public PaymentGatewayRejectedException(String operation, Integer remoteStatus, String remoteBody) {
        super(ErrorCode.PAYMENT_GATEWAY_REJECTED,
                String.format("operation=%s, status=%s, body=%s", operation, remoteStatus, remoteBody));
        this.remoteStatus = remoteStatus;
    }

    public PaymentGatewayRejectedException(String operation, Throwable cause) {
        super(ErrorCode.PAYMENT_GATEWAY_REJECTED, "operation=" + operation + ", reason=" + cause.getMessage(), cause);
        this.remoteStatus = null;
    }

    public Integer getRemoteStatus() {
        return remoteStatus;
    }
}
