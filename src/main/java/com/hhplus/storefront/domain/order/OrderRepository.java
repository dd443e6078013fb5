package com.hhplus.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Port)
 */
public interface OrderRepository {

    Order save(Order order);

    /**
     * 주문 조회 (주문 항목 포함)
     */
    Optional<Order> findById(Long orderId);

    /**
     * 주문 조회 + 배타 락
     * 상태/결제/수령 필드를 바꾸는 작업은 이 메서드로 조회한다.
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    /**
     * 사용자별 주문 목록 (최신순)
     */
    List<Order> findByUserId(Long userId);

    void delete(Order order);

    /**
     * 상품 삭제 시 주문 항목의 상품 참조 해제
     * 스냅샷(상품명, 단가)은 그대로 남는다.
     *
     * @return 참조가 해제된 주문 항목 수
     */
    int detachProduct(Long productId);
}
