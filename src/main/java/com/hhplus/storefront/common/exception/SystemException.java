package com.hhplus.storefront.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 데이터베이스, 외부 결제 게이트웨이 등 인프라 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 사용 예:
 * - PaymentGatewayTimeoutException: 게이트웨이 응답 시간 초과
 * - PaymentGatewayRejectedException: 게이트웨이 오류 응답
 * - 락 재시도 소진 (LOCK_ACQUISITION_FAILED)
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
