package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderLine;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final AtomicLong orderIdSequence = new AtomicLong(5000L);
    private final AtomicLong orderLineIdSequence = new AtomicLong(5000L);

    @Override
    public Order save(Order order) {
        if (order.getOrderId() != null) {
            orders.put(order.getOrderId(), order);
            return order;
        }

        // Builder로 ID가 할당된 새 인스턴스를 만든다 (Setter 사용 안 함)
        List<OrderLine> savedLines = order.getOrderLines().stream()
                .map(line -> line.getOrderLineId() != null ? line
                        : line.toBuilder().orderLineId(orderLineIdSequence.incrementAndGet()).build())
                .collect(Collectors.toCollection(ArrayList::new));

        Order savedOrder = order.toBuilder()
                .orderId(orderIdSequence.incrementAndGet())
                .orderLines(savedLines)
                .build();
        orders.put(savedOrder.getOrderId(), savedOrder);
        return savedOrder;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    /**
     * 인메모리 구현은 락을 잡지 않는다. (단위 테스트용)
     */
    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return findById(orderId);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .sorted(Comparator.comparing(Order::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public void delete(Order order) {
        orders.remove(order.getOrderId());
    }

    @Override
    public int detachProduct(Long productId) {
        int detached = 0;
        for (Order order : orders.values()) {
            for (OrderLine line : order.getOrderLines()) {
                if (productId.equals(line.getProductId())) {
                    line.detachProduct();
                    detached++;
                }
            }
        }
        return detached;
    }

    /**
     * 테스트용: 모든 주문 삭제
     */
    public void clear() {
        orders.clear();
    }
}
