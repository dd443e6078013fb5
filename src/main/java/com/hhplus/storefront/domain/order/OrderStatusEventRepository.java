package com.hhplus.storefront.domain.order;

import java.util.List;

/**
 * OrderStatusEvent Repository Interface (Port)
 * append-only: 추가와 조회만 제공한다.
 */
public interface OrderStatusEventRepository {

    OrderStatusEvent append(OrderStatusEvent event);

    /**
     * 주문의 상태 이력 (발생 순)
     */
    List<OrderStatusEvent> findByOrderId(Long orderId);
}
