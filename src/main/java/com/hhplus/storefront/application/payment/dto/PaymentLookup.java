package com.hhplus.storefront.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 상태 조회 결과
 * amountMinor는 최소 화폐 단위 (100 = 1.00)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentLookup {
    private String transactionRef;
    private PaymentGatewayStatus status;
    private long amountMinor;
    private String gatewayTransactionId;
}
