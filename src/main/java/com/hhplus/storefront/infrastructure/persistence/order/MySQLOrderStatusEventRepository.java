package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.OrderStatusEvent;
import com.hhplus.storefront.domain.order.OrderStatusEventRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 OrderStatusEvent Repository 구현
 */
@Repository
@Primary
public class MySQLOrderStatusEventRepository implements OrderStatusEventRepository {

    private final OrderStatusEventJpaRepository orderStatusEventJpaRepository;

    public MySQLOrderStatusEventRepository(OrderStatusEventJpaRepository orderStatusEventJpaRepository) {
        this.orderStatusEventJpaRepository = orderStatusEventJpaRepository;
    }

    @Override
    public OrderStatusEvent append(OrderStatusEvent event) {
        if (event.getEventId() != null) {
            throw new IllegalArgumentException("이미 저장된 이력은 다시 저장할 수 없습니다: eventId=" + event.getEventId());
        }
        return orderStatusEventJpaRepository.save(event);
    }

    @Override
    public List<OrderStatusEvent> findByOrderId(Long orderId) {
        return orderStatusEventJpaRepository.findByOrderIdOrderByCreatedAtAscEventIdAsc(orderId);
    }
}
