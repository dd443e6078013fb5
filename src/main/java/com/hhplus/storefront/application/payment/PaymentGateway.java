package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.application.payment.dto.PaymentInitiation;
import com.hhplus.storefront.application.payment.dto.PaymentInitiationRequest;
import com.hhplus.storefront.application.payment.dto.PaymentLookup;

import java.time.Duration;

/**
 * 외부 결제 게이트웨이 Port
 *
 * 모든 호출은 호출자가 지정한 timeout 안에 끝나야 한다.
 * - 시간 초과: PaymentGatewayTimeoutException
 * - 게이트웨이 오류 응답/통신 오류: PaymentGatewayRejectedException
 */
public interface PaymentGateway {

    /**
     * 결제 개시
     *
     * @return 결제 페이지 URL과 게이트웨이 거래 식별자
     */
    PaymentInitiation initiate(PaymentInitiationRequest request, Duration timeout);

    /**
     * 결제 상태 조회
     */
    PaymentLookup lookup(String transactionRef, Duration timeout);
}
