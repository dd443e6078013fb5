package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 상태 전이 (전이표 검증)
 * - 결제 확인 플래그, 수령 확인 플래그 관리
 * - 취소 가능 여부 판단 (고객/관리자)
 *
 * 핵심 비즈니스 규칙:
 * - 주문자 정보, 총액, 주문 항목은 생성 후 변경되지 않음
 * - 변경 가능한 것은 상태, 결제 확인 플래그, 수령 확인 정보뿐
 * - 종료 상태(DELIVERED, CANCELLED)에서는 다시 열리지 않음
 * - 결제 확인은 상태를 바꾸지 않음
 */
@Entity
@Table(name = "orders")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Embedded
    private CustomerInfo customerInfo;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "order_status", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "payment_method", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_confirmed", nullable = false)
    private boolean paymentConfirmed;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(name = "order_notes", length = 1000)
    private String orderNotes;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "received", nullable = false)
    private boolean received;

    @Column(name = "received_at")
    private LocalDateTime receivedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * 주문 항목
     * 주문 삭제 시 항목도 함께 삭제된다. 상태 이력(OrderStatusEvent)은 별도 테이블이라 남는다.
     */
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @Builder.Default
    private List<OrderLine> orderLines = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드 (정적 팩토리)
     *
     * 비즈니스 규칙:
     * - 주문 항목 1개 이상
     * - 총액은 항목 소계의 합으로 계산되어 고정됨
     * - PENDING, 결제 미확인 상태로 생성
     */
    public static Order create(Long userId, CustomerInfo customerInfo, PaymentMethod paymentMethod,
                               String orderNotes, List<OrderLine> lines, LocalDateTime now) {
        if (customerInfo == null) {
            throw new InvalidArgumentException(OrderConstants.MSG_CUSTOMER_INFO_REQUIRED);
        }
        customerInfo.validate();
        if (paymentMethod == null) {
            throw new InvalidArgumentException(OrderConstants.MSG_PAYMENT_METHOD_REQUIRED);
        }
        if (lines == null || lines.isEmpty()) {
            throw new InvalidArgumentException(OrderConstants.MSG_EMPTY_ORDER_LINES);
        }

        BigDecimal total = lines.stream()
                .map(OrderLine::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return Order.builder()
                .userId(userId)
                .customerInfo(customerInfo)
                .paymentMethod(paymentMethod)
                .orderNotes(orderNotes)
                .totalAmount(total)
                .orderStatus(OrderStatus.PENDING)
                .paymentConfirmed(false)
                .received(false)
                .orderLines(new ArrayList<>(lines))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 상태 전이
     *
     * @return 전이 전 상태
     * @throws InvalidTransitionException 전이표에 없는 변경
     */
    public OrderStatus transitionTo(OrderStatus next, OrderTransitionTable table, LocalDateTime now) {
        if (!table.isAllowed(this.orderStatus, next)) {
            throw new InvalidTransitionException(this.orderId, this.orderStatus, next);
        }
        OrderStatus previous = this.orderStatus;
        this.orderStatus = next;
        this.updatedAt = now;
        return previous;
    }

    /**
     * 취소 (CANCELLED 전이 + 사유 기록)
     * 이미 종료된 주문은 전이표 검증에서 거절되므로 재고 복구가 두 번 일어나지 않는다.
     */
    public OrderStatus cancel(String reason, OrderTransitionTable table, LocalDateTime now) {
        OrderStatus previous = transitionTo(OrderStatus.CANCELLED, table, now);
        this.cancellationReason = reason;
        this.cancelledAt = now;
        return previous;
    }

    /**
     * 고객 취소 가능 여부 검증
     *
     * 비즈니스 규칙:
     * - 상태가 SHIPPED, OUT_FOR_DELIVERY, DELIVERED, CANCELLED가 아님
     * - 주문 후 cancelWindow 이내
     */
    public void ensureCancellableByCustomer(LocalDateTime now, Duration cancelWindow) {
        if (OrderConstants.CUSTOMER_NON_CANCELLABLE_STATUSES.contains(this.orderStatus)) {
            throw new OrderNotCancellableException(this.orderId, this.orderStatus,
                    this.orderStatus.getDisplayName() + " 상태의 주문은 고객이 취소할 수 없습니다");
        }
        Duration elapsed = Duration.between(this.createdAt, now);
        if (elapsed.compareTo(cancelWindow) > 0) {
            throw new OrderNotCancellableException(this.orderId, this.orderStatus,
                    String.format("주문 후 %d분이 지나 취소할 수 없습니다 (경과: %d분)",
                            cancelWindow.toMinutes(), elapsed.toMinutes()));
        }
    }

    /**
     * 관리자 취소 가능 여부 검증 (시간 제한 없음)
     */
    public void ensureCancellableByOperator(OrderTransitionTable table) {
        if (!table.isAllowed(this.orderStatus, OrderStatus.CANCELLED)) {
            throw new OrderNotCancellableException(this.orderId, this.orderStatus,
                    "종료된 주문은 취소할 수 없습니다");
        }
    }

    /**
     * 결제 확인 (멱등)
     *
     * @return 이번 호출로 플래그가 바뀌었으면 true, 이미 확인된 주문이면 false
     */
    public boolean markPaid(LocalDateTime now) {
        if (this.paymentConfirmed) {
            return false;
        }
        this.paymentConfirmed = true;
        this.updatedAt = now;
        return true;
    }

    /**
     * 고객 수령 확인
     *
     * @throws InvalidOrderStateException 배송 완료 전이거나 이미 수령 확인된 주문
     */
    public void confirmReceipt(LocalDateTime now) {
        if (this.orderStatus != OrderStatus.DELIVERED) {
            throw new InvalidOrderStateException(this.orderId,
                    "배송 완료된 주문만 수령 확인할 수 있습니다. 현재 상태: " + this.orderStatus);
        }
        if (this.received) {
            throw new InvalidOrderStateException(this.orderId, "이미 수령 확인된 주문입니다");
        }
        this.received = true;
        this.receivedAt = now;
        this.updatedAt = now;
    }

    public void assignPaymentReference(String paymentReference) {
        this.paymentReference = paymentReference;
    }

    public void verifyOwner(Long userId) {
        if (!this.userId.equals(userId)) {
            throw new OrderAccessDeniedException(this.orderId, userId);
        }
    }

    public boolean isCancelled() {
        return this.orderStatus == OrderStatus.CANCELLED;
    }

    public boolean isTerminal() {
        return this.orderStatus.isTerminal();
    }

    public int getTotalQuantity() {
        return this.orderLines.stream()
                .mapToInt(OrderLine::getQuantity)
                .sum();
    }
}
