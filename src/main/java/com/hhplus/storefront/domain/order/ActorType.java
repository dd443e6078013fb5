package com.hhplus.storefront.domain.order;

/**
 * 주문 상태 변경 주체 유형
 */
public enum ActorType {
    SYSTEM,
    OPERATOR,
    CUSTOMER
}
