package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory Cart Repository 구현
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 */
@Repository
public class InMemoryCartRepository implements CartRepository {

    private final ConcurrentHashMap<Long, Cart> cartsByUserId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, CartLine> lines = new ConcurrentHashMap<>();
    private final AtomicLong cartIdSequence = new AtomicLong(0);
    private final AtomicLong cartLineIdSequence = new AtomicLong(0);

    @Override
    public Cart findOrCreateByUserId(Long userId) {
        return cartsByUserId.computeIfAbsent(userId, id ->
                Cart.createCart(id).toBuilder().cartId(cartIdSequence.incrementAndGet()).build());
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return Optional.ofNullable(cartsByUserId.get(userId));
    }

    @Override
    public Optional<CartLine> findLineById(Long cartLineId) {
        return Optional.ofNullable(lines.get(cartLineId));
    }

    @Override
    public Optional<CartLine> findLine(Long cartId, Long productId, Long sizeId) {
        return lines.values().stream()
                .filter(line -> line.getCartId().equals(cartId) && line.matches(productId, sizeId))
                .findFirst();
    }

    @Override
    public List<CartLine> findLines(Long cartId) {
        return lines.values().stream()
                .filter(line -> line.getCartId().equals(cartId))
                .sorted(Comparator.comparing(CartLine::getCartLineId))
                .collect(Collectors.toList());
    }

    @Override
    public CartLine saveLine(CartLine cartLine) {
        CartLine saved = cartLine.getCartLineId() == null
                ? cartLine.toBuilder().cartLineId(cartLineIdSequence.incrementAndGet()).build()
                : cartLine;
        lines.put(saved.getCartLineId(), saved);
        return saved;
    }

    @Override
    public void deleteLine(Long cartLineId) {
        lines.remove(cartLineId);
    }

    @Override
    public void deleteLines(Long cartId) {
        lines.values().removeIf(line -> line.getCartId().equals(cartId));
    }

    @Override
    public int deleteLinesByProductId(Long productId) {
        int before = lines.size();
        lines.values().removeIf(line -> line.getProductId().equals(productId));
        return before - lines.size();
    }
}
