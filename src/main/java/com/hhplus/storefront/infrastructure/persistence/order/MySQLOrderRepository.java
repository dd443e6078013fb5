package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final OrderLineJpaRepository orderLineJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository,
                                OrderLineJpaRepository orderLineJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
        this.orderLineJpaRepository = orderLineJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithLines(orderId);
    }

    @Override
    @Transactional
    public Optional<Order> findByIdForUpdate(Long orderId) {
        // 트랜잭션 안에서만 락이 유지된다 (commit/rollback 시 해제)
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public List<Order> findByUserId(Long userId) {
        return orderJpaRepository.findByUserIdWithLines(userId);
    }

    @Override
    public void delete(Order order) {
        orderJpaRepository.delete(order);
    }

    @Override
    @Transactional
    public int detachProduct(Long productId) {
        return orderLineJpaRepository.detachProduct(productId);
    }
}
