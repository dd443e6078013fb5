package com.hhplus.storefront.domain.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * OrderConstants - 주문 도메인 상수
 */
public final class OrderConstants {

    private OrderConstants() {
        throw new AssertionError("Cannot instantiate OrderConstants");
    }

    // ========== Cancellation Constants ==========

    /** 고객 취소 가능 시간 기본값 (분) */
    public static final long DEFAULT_CUSTOMER_CANCEL_WINDOW_MINUTES = 30L;

    /** 고객이 취소할 수 없는 상태 */
    public static final Set<OrderStatus> CUSTOMER_NON_CANCELLABLE_STATUSES = EnumSet.of(
            OrderStatus.SHIPPED,
            OrderStatus.OUT_FOR_DELIVERY,
            OrderStatus.DELIVERED,
            OrderStatus.CANCELLED
    );

    // ========== Cancellation Reasons ==========

    public static final String REASON_CANCELLED_BY_CUSTOMER = "고객 요청에 의한 취소";
    public static final String REASON_CANCELLED_BY_OPERATOR = "관리자에 의한 취소";
    public static final String REASON_DELETED_BY_STORE = "스토어에 의한 주문 삭제";
    public static final String REASON_PAYMENT_AMOUNT_MISMATCH = "결제 금액 불일치";
    public static final String REASON_PAYMENT_FAILED = "결제 실패";
    public static final String REASON_PAYMENT_GATEWAY_REJECTED = "결제 게이트웨이 오류";
    public static final String REASON_PAYMENT_INITIATION_FAILED = "결제 개시 실패";

    // ========== Event Notes ==========

    public static final String NOTE_ORDER_PLACED = "주문 생성";
    public static final String NOTE_PAYMENT_CONFIRMED = "결제 확인";
    public static final String NOTE_COD_PAYMENT_RECEIVED = "착불 결제 수령 확인";
    public static final String NOTE_RECEIPT_CONFIRMED = "고객 수령 확인";
    public static final String NOTE_ONLINE_PAYMENT_VERIFIED = "온라인 결제 검증 완료";

    // ========== Validation Messages ==========

    public static final String MSG_EMPTY_ORDER_LINES = "주문 항목은 1개 이상이어야 합니다";
    public static final String MSG_CUSTOMER_INFO_REQUIRED = "주문자 정보는 필수입니다";
    public static final String MSG_PAYMENT_METHOD_REQUIRED = "결제 수단은 필수입니다";
}
