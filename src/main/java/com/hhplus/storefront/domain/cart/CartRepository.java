package com.hhplus.storefront.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 */
public interface CartRepository {

    /**
     * 사용자의 장바구니 조회 또는 생성
     */
    Cart findOrCreateByUserId(Long userId);

    Optional<Cart> findByUserId(Long userId);

    Optional<CartLine> findLineById(Long cartLineId);

    /**
     * 장바구니에서 (상품, 사이즈) 조합으로 항목 조회
     * sizeId가 null이면 사이즈 없는 항목을 찾는다.
     */
    Optional<CartLine> findLine(Long cartId, Long productId, Long sizeId);

    List<CartLine> findLines(Long cartId);

    CartLine saveLine(CartLine cartLine);

    void deleteLine(Long cartLineId);

    /**
     * 장바구니 비우기 (주문 완료 후)
     */
    void deleteLines(Long cartId);

    /**
     * 상품 삭제 시 모든 장바구니에서 해당 상품 항목 제거
     *
     * @return 삭제된 항목 수
     */
    int deleteLinesByProductId(Long productId);
}
