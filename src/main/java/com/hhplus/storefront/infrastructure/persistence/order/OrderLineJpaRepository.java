package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.OrderLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * OrderLine JPA Repository
 */
public interface OrderLineJpaRepository extends JpaRepository<OrderLine, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OrderLine ol SET ol.productId = NULL WHERE ol.productId = :productId")
    int detachProduct(@Param("productId") Long productId);
}
