package com.hhplus.storefront.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderTransitionTable 테스트")
class OrderTransitionTableTest {

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"DELIVERED", "CANCELLED"})
    @DisplayName("종료 상태에서는 나가는 전이가 없다")
    void testTerminalStatesHaveNoExit(OrderStatus terminal) {
        assertTrue(OrderTransitionTable.standard().allowedNext(terminal).isEmpty());
        assertTrue(OrderTransitionTable.extended().allowedNext(terminal).isEmpty());
    }

    @Test
    @DisplayName("standard 정책 - CONFIRMED, OUT_FOR_DELIVERY를 거치지 않는다")
    void testStandardPolicy() {
        OrderTransitionTable table = OrderTransitionTable.standard();

        assertEquals(Set.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED), table.allowedNext(OrderStatus.PENDING));
        assertTrue(table.isAllowed(OrderStatus.SHIPPED, OrderStatus.DELIVERED));
        assertFalse(table.isAllowed(OrderStatus.PENDING, OrderStatus.SHIPPED));
        assertEquals(OrderStatus.PROCESSING, table.paymentConfirmedStatus());
    }

    @Test
    @DisplayName("extended 정책 - PENDING 다음은 CONFIRMED")
    void testExtendedPolicy() {
        OrderTransitionTable table = OrderTransitionTable.extended();

        assertEquals(OrderStatus.CONFIRMED, table.paymentConfirmedStatus());
        assertTrue(table.isAllowed(OrderStatus.SHIPPED, OrderStatus.OUT_FOR_DELIVERY));
        assertFalse(table.isAllowed(OrderStatus.SHIPPED, OrderStatus.DELIVERED));
    }

    @Test
    @DisplayName("종료되지 않은 모든 상태에서 CANCELLED로 갈 수 있다")
    void testCancellableFromEveryOpenState() {
        for (OrderTransitionTable table : new OrderTransitionTable[]{
                OrderTransitionTable.standard(), OrderTransitionTable.extended()}) {
            for (OrderStatus status : OrderStatus.values()) {
                if (!status.isTerminal() && !table.allowedNext(status).isEmpty()) {
                    assertTrue(table.isAllowed(status, OrderStatus.CANCELLED),
                            table.getPolicyName() + ": " + status);
                }
            }
        }
    }

    @Test
    @DisplayName("정책 이름으로 선택 - 알 수 없는 이름은 거절")
    void testForPolicy() {
        assertEquals("standard", OrderTransitionTable.forPolicy(null).getPolicyName());
        assertEquals("extended", OrderTransitionTable.forPolicy(" Extended ").getPolicyName());
        assertThrows(IllegalArgumentException.class, () -> OrderTransitionTable.forPolicy("express"));
    }
}
