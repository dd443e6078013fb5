package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Size;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Size JPA Repository
 */
public interface SizeJpaRepository extends JpaRepository<Size, Long> {

    List<Size> findAllByOrderBySortOrderAscNameAsc();
}
