package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.OrderStatusEvent;
import com.hhplus.storefront.domain.order.OrderStatusEventRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory OrderStatusEvent Repository 구현 (append-only 리스트)
 */
@Repository
public class InMemoryOrderStatusEventRepository implements OrderStatusEventRepository {

    private final List<OrderStatusEvent> events = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong eventIdSequence = new AtomicLong(0);

    @Override
    public OrderStatusEvent append(OrderStatusEvent event) {
        if (event.getEventId() != null) {
            throw new IllegalArgumentException("이미 저장된 이력은 다시 저장할 수 없습니다: eventId=" + event.getEventId());
        }
        OrderStatusEvent saved = event.toBuilder().eventId(eventIdSequence.incrementAndGet()).build();
        events.add(saved);
        return saved;
    }

    @Override
    public List<OrderStatusEvent> findByOrderId(Long orderId) {
        synchronized (events) {
            return events.stream()
                    .filter(event -> event.getOrderId().equals(orderId))
                    .collect(Collectors.toList());
        }
    }
}
