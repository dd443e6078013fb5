package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.OrderStatusEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * OrderStatusEvent JPA Repository
 */
public interface OrderStatusEventJpaRepository extends JpaRepository<OrderStatusEvent, Long> {

    List<OrderStatusEvent> findByOrderIdOrderByCreatedAtAscEventIdAsc(Long orderId);
}
