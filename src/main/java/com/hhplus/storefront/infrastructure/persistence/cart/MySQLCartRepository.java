package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartLineJpaRepository cartLineJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository, CartLineJpaRepository cartLineJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartLineJpaRepository = cartLineJpaRepository;
    }

    @Override
    public Cart findOrCreateByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId)
                .orElseGet(() -> cartJpaRepository.save(Cart.createCart(userId)));
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<CartLine> findLineById(Long cartLineId) {
        return cartLineJpaRepository.findById(cartLineId);
    }

    @Override
    public Optional<CartLine> findLine(Long cartId, Long productId, Long sizeId) {
        return cartLineJpaRepository.findByCartIdAndProductIdAndSizeKey(cartId, productId, CartLine.sizeKeyOf(sizeId));
    }

    @Override
    public List<CartLine> findLines(Long cartId) {
        return cartLineJpaRepository.findByCartIdOrderByCartLineIdAsc(cartId);
    }

    @Override
    public CartLine saveLine(CartLine cartLine) {
        return cartLineJpaRepository.save(cartLine);
    }

    @Override
    public void deleteLine(Long cartLineId) {
        cartLineJpaRepository.deleteById(cartLineId);
    }

    @Override
    @Transactional
    public void deleteLines(Long cartId) {
        cartLineJpaRepository.deleteByCartId(cartId);
    }

    @Override
    @Transactional
    public int deleteLinesByProductId(Long productId) {
        return cartLineJpaRepository.deleteByProductId(productId);
    }
}
