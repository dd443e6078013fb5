package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.CartLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CartLine JPA Repository
 */
public interface CartLineJpaRepository extends JpaRepository<CartLine, Long> {

    List<CartLine> findByCartIdOrderByCartLineIdAsc(Long cartId);

    Optional<CartLine> findByCartIdAndProductIdAndSizeKey(Long cartId, Long productId, Long sizeKey);

    @Modifying
    @Query("DELETE FROM CartLine cl WHERE cl.cartId = :cartId")
    int deleteByCartId(@Param("cartId") Long cartId);

    @Modifying
    @Query("DELETE FROM CartLine cl WHERE cl.productId = :productId")
    int deleteByProductId(@Param("productId") Long productId);
}
