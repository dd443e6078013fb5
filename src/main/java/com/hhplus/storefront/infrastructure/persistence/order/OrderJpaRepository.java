package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 *
 * Order.orderLines는 LAZY이므로 조회 시 fetch join을 사용한다.
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderLines ol " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLines(@Param("orderId") Long orderId);

    /**
     * 주문 ID로 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * 상태 전이, 결제 확인, 수령 확인, 삭제가 같은 주문에 동시에 들어와도
     * 한 번에 하나씩 처리되어 재고가 두 번 복구되지 않는다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderLines ol " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderLines ol " +
           "WHERE o.userId = :userId " +
           "ORDER BY o.createdAt DESC")
    List<Order> findByUserIdWithLines(@Param("userId") Long userId);
}
