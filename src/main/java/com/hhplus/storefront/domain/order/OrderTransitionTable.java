package com.hhplus.storefront.domain.order;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 주문 상태 전이표
 *
 * 고객 API, 관리자 API, 결제 콜백, 주문 삭제 등 모든 진입점이 이 전이표 하나만 참조한다.
 *
 * 불변식:
 * - 종료 상태(DELIVERED, CANCELLED)에서 나가는 전이는 없다
 * - 종료되지 않은 모든 상태에서 CANCELLED로 갈 수 있다
 */
public final class OrderTransitionTable {

    public static final String STANDARD_POLICY = "standard";
    public static final String EXTENDED_POLICY = "extended";

    private final String policyName;
    private final Map<OrderStatus, Set<OrderStatus>> allowedNext;

    private OrderTransitionTable(String policyName, Map<OrderStatus, Set<OrderStatus>> allowedNext) {
        validate(allowedNext);
        this.policyName = policyName;
        EnumMap<OrderStatus, Set<OrderStatus>> copy = new EnumMap<>(OrderStatus.class);
        allowedNext.forEach((from, to) -> copy.put(from, Collections.unmodifiableSet(EnumSet.copyOf(to))));
        this.allowedNext = Collections.unmodifiableMap(copy);
    }

    /**
     * 기본 정책
     * PENDING → PROCESSING → PACKED → SHIPPED → DELIVERED
     */
    public static OrderTransitionTable standard() {
        Map<OrderStatus, Set<OrderStatus>> table = new EnumMap<>(OrderStatus.class);
        table.put(OrderStatus.PENDING, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED));
        table.put(OrderStatus.PROCESSING, EnumSet.of(OrderStatus.PACKED, OrderStatus.CANCELLED));
        table.put(OrderStatus.PACKED, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED));
        table.put(OrderStatus.SHIPPED, EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED));
        return new OrderTransitionTable(STANDARD_POLICY, table);
    }

    /**
     * 확장 정책
     * PENDING → CONFIRMED → PROCESSING → PACKED → SHIPPED → OUT_FOR_DELIVERY → DELIVERED
     */
    public static OrderTransitionTable extended() {
        Map<OrderStatus, Set<OrderStatus>> table = new EnumMap<>(OrderStatus.class);
        table.put(OrderStatus.PENDING, EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED));
        table.put(OrderStatus.CONFIRMED, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED));
        table.put(OrderStatus.PROCESSING, EnumSet.of(OrderStatus.PACKED, OrderStatus.CANCELLED));
        table.put(OrderStatus.PACKED, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED));
        table.put(OrderStatus.SHIPPED, EnumSet.of(OrderStatus.OUT_FOR_DELIVERY, OrderStatus.CANCELLED));
        table.put(OrderStatus.OUT_FOR_DELIVERY, EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED));
        return new OrderTransitionTable(EXTENDED_POLICY, table);
    }

    /**
     * 설정값으로 전이표 선택
     *
     * @param policyName "standard" 또는 "extended"
     */
    public static OrderTransitionTable forPolicy(String policyName) {
        if (policyName == null || STANDARD_POLICY.equalsIgnoreCase(policyName.trim())) {
            return standard();
        }
        if (EXTENDED_POLICY.equalsIgnoreCase(policyName.trim())) {
            return extended();
        }
        throw new IllegalArgumentException("알 수 없는 주문 상태 정책입니다: " + policyName);
    }

    public boolean isAllowed(OrderStatus from, OrderStatus to) {
        return allowedNext(from).contains(to);
    }

    public Set<OrderStatus> allowedNext(OrderStatus from) {
        return allowedNext.getOrDefault(from, Collections.emptySet());
    }

    /**
     * 결제 확인 후 이동할 상태 (PENDING 다음 단계)
     * standard: PROCESSING, extended: CONFIRMED
     */
    public OrderStatus paymentConfirmedStatus() {
        return allowedNext(OrderStatus.PENDING).stream()
                .filter(status -> status != OrderStatus.CANCELLED)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("PENDING 이후 상태가 정의되지 않았습니다"));
    }

    public String getPolicyName() {
        return policyName;
    }

    private static void validate(Map<OrderStatus, Set<OrderStatus>> table) {
        for (Map.Entry<OrderStatus, Set<OrderStatus>> entry : table.entrySet()) {
            OrderStatus from = entry.getKey();
            if (from.isTerminal() && !entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("종료 상태에서는 전이할 수 없습니다: " + from);
            }
            if (!from.isTerminal() && !entry.getValue().contains(OrderStatus.CANCELLED)) {
                throw new IllegalArgumentException("종료되지 않은 상태는 취소로 전이할 수 있어야 합니다: " + from);
            }
        }
    }
}
