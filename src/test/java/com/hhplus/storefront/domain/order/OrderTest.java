package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 단위 테스트
 */
@DisplayName("Order 도메인 테스트")
class OrderTest {

    private static final LocalDateTime CREATED_AT = LocalDateTime.of(2026, 3, 2, 10, 0);
    private static final Duration CANCEL_WINDOW = Duration.ofMinutes(30);

    private final OrderTransitionTable standard = OrderTransitionTable.standard();
    private Order order;

    @BeforeEach
    void setup() {
        order = Order.create(1L, customer(), PaymentMethod.CASH_ON_DELIVERY, "문 앞에 놓아주세요",
                List.of(
                        OrderLine.createLine(10L, "티셔츠", 1L, "M", new BigDecimal("19.99"), 2),
                        OrderLine.createLine(20L, "머그컵", null, null, new BigDecimal("5.50"), 1)),
                CREATED_AT);
    }

    @Test
    @DisplayName("주문 생성 - 총액은 항목 소계의 합, PENDING/미결제 상태")
    void testCreate() {
        assertEquals(new BigDecimal("45.48"), order.getTotalAmount());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertFalse(order.isPaymentConfirmed());
        assertFalse(order.isReceived());
        assertEquals(3, order.getTotalQuantity());
    }

    @Test
    @DisplayName("주문 생성 - 항목이 없으면 실패")
    void testCreate_EmptyLines() {
        assertThrows(InvalidArgumentException.class, () ->
                Order.create(1L, customer(), PaymentMethod.KHALTI, null, List.of(), CREATED_AT));
    }

    @Test
    @DisplayName("주문 생성 - 주소 누락 시 실패")
    void testCreate_MissingAddress() {
        CustomerInfo noAddress = CustomerInfo.builder()
                .fullName("김하나").email("hana@example.com").phone("010").city("서울").build();
        assertThrows(InvalidArgumentException.class, () ->
                Order.create(1L, noAddress, PaymentMethod.KHALTI, null,
                        List.of(OrderLine.createLine(10L, "티셔츠", null, null, BigDecimal.TEN, 1)), CREATED_AT));
    }

    @Test
    @DisplayName("상태 전이 - 전이표에 있는 변경만 허용")
    void testTransition() {
        OrderStatus previous = order.transitionTo(OrderStatus.PROCESSING, standard, CREATED_AT.plusMinutes(1));

        assertEquals(OrderStatus.PENDING, previous);
        assertEquals(OrderStatus.PROCESSING, order.getOrderStatus());
        assertThrows(InvalidTransitionException.class,
                () -> order.transitionTo(OrderStatus.DELIVERED, standard, CREATED_AT.plusMinutes(2)));
        assertEquals(OrderStatus.PROCESSING, order.getOrderStatus());
    }

    @Test
    @DisplayName("취소 후에는 어떤 상태로도 전이할 수 없다")
    void testCancelledIsTerminal() {
        order.cancel("고객 요청", standard, CREATED_AT.plusMinutes(5));

        assertTrue(order.isCancelled());
        assertEquals("고객 요청", order.getCancellationReason());
        assertNotNull(order.getCancelledAt());
        for (OrderStatus next : OrderStatus.values()) {
            assertThrows(InvalidTransitionException.class,
                    () -> order.transitionTo(next, standard, CREATED_AT.plusMinutes(6)));
        }
    }

    @Test
    @DisplayName("고객 취소 - 10분 경과 시 허용, 40분 경과 시 거절")
    void testCustomerCancelWindow() {
        assertDoesNotThrow(() -> order.ensureCancellableByCustomer(CREATED_AT.plusMinutes(10), CANCEL_WINDOW));

        OrderNotCancellableException e = assertThrows(OrderNotCancellableException.class,
                () -> order.ensureCancellableByCustomer(CREATED_AT.plusMinutes(40), CANCEL_WINDOW));
        assertTrue(e.getMessage().contains("30분"));
    }

    @Test
    @DisplayName("고객 취소 - 발송된 주문은 시간과 무관하게 거절")
    void testCustomerCancel_Shipped() {
        order.transitionTo(OrderStatus.PROCESSING, standard, CREATED_AT);
        order.transitionTo(OrderStatus.PACKED, standard, CREATED_AT);
        order.transitionTo(OrderStatus.SHIPPED, standard, CREATED_AT);

        assertThrows(OrderNotCancellableException.class,
                () -> order.ensureCancellableByCustomer(CREATED_AT.plusMinutes(1), CANCEL_WINDOW));
        assertDoesNotThrow(() -> order.ensureCancellableByOperator(standard));
    }

    @Test
    @DisplayName("결제 확인은 멱등이며 상태를 바꾸지 않는다")
    void testMarkPaid_Idempotent() {
        assertTrue(order.markPaid(CREATED_AT.plusMinutes(1)));
        assertFalse(order.markPaid(CREATED_AT.plusMinutes(2)));

        assertTrue(order.isPaymentConfirmed());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
    }

    @Test
    @DisplayName("수령 확인 - 배송 완료 전이면 거절, 두 번째 확인도 거절")
    void testConfirmReceipt() {
        assertThrows(InvalidOrderStateException.class, () -> order.confirmReceipt(CREATED_AT));

        order.transitionTo(OrderStatus.PROCESSING, standard, CREATED_AT);
        order.transitionTo(OrderStatus.PACKED, standard, CREATED_AT);
        order.transitionTo(OrderStatus.SHIPPED, standard, CREATED_AT);
        order.transitionTo(OrderStatus.DELIVERED, standard, CREATED_AT);

        LocalDateTime receivedAt = CREATED_AT.plusDays(3);
        order.confirmReceipt(receivedAt);

        assertTrue(order.isReceived());
        assertEquals(receivedAt, order.getReceivedAt());
        assertThrows(InvalidOrderStateException.class, () -> order.confirmReceipt(receivedAt.plusHours(1)));
    }

    @Test
    @DisplayName("소유자 검증 - 다른 사용자는 거절")
    void testVerifyOwner() {
        assertDoesNotThrow(() -> order.verifyOwner(1L));
        assertThrows(OrderAccessDeniedException.class, () -> order.verifyOwner(2L));
    }

    @Test
    @DisplayName("수령인 정보가 없으면 주문자 정보를 사용")
    void testEffectiveReceiver() {
        assertEquals("김하나", order.getCustomerInfo().getEffectiveReceiverName());
        assertEquals("010-1234-5678", order.getCustomerInfo().getEffectiveReceiverPhone());
    }

    private static CustomerInfo customer() {
        return CustomerInfo.builder()
                .fullName("김하나")
                .email("hana@example.com")
                .phone("010-1234-5678")
                .address("테헤란로 123")
                .city("서울")
                .build();
    }
}
