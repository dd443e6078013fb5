package com.hhplus.storefront.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * Size 마스터 Repository Interface (Port)
 */
public interface SizeRepository {

    Optional<Size> findById(Long sizeId);

    /**
     * sortOrder 오름차순 전체 조회
     */
    List<Size> findAllOrdered();

    Size save(Size size);
}
