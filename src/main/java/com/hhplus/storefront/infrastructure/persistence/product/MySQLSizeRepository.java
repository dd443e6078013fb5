package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Size Repository 구현
 */
@Repository
@Primary
public class MySQLSizeRepository implements SizeRepository {

    private final SizeJpaRepository sizeJpaRepository;

    public MySQLSizeRepository(SizeJpaRepository sizeJpaRepository) {
        this.sizeJpaRepository = sizeJpaRepository;
    }

    @Override
    public Optional<Size> findById(Long sizeId) {
        return sizeJpaRepository.findById(sizeId);
    }

    @Override
    public List<Size> findAllOrdered() {
        return sizeJpaRepository.findAllByOrderBySortOrderAscNameAsc();
    }

    @Override
    public Size save(Size size) {
        return sizeJpaRepository.save(size);
    }
}
