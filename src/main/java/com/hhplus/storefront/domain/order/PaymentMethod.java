package com.hhplus.storefront.domain.order;

/**
 * 결제 수단
 */
public enum PaymentMethod {
    CASH_ON_DELIVERY("착불 결제", false),
    KHALTI("Khalti", true),
    ESEWA("eSewa", true),
    BANK_TRANSFER("계좌 이체", false);

    private final String displayName;
    private final boolean online;

    PaymentMethod(String displayName, boolean online) {
        this.displayName = displayName;
        this.online = online;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 외부 결제 게이트웨이 확인이 필요한 결제 수단인지
     */
    public boolean isOnline() {
        return online;
    }
}
