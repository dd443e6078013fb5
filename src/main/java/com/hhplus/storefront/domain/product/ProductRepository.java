package com.hhplus.storefront.domain.product;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Port)
 *
 * 재고 변경은 조건부 원자 연산으로만 수행한다.
 * decrease* 계열은 "현재 재고 >= 요청 수량"일 때만 차감하고, 반영된 행 수를 반환한다.
 * 반환값 0은 재고 부족(또는 대상 없음)을 의미하며 어떤 상태도 바뀌지 않는다.
 */
public interface ProductRepository {

    List<Product> findAll();

    Optional<Product> findById(Long productId);

    Product save(Product product);

    void deleteById(Long productId);

    /**
     * 단가만 갱신한다. 재고 컬럼은 건드리지 않는다.
     *
     * @return 반영된 행 수 (0: 상품 없음)
     */
    int updatePrice(Long productId, BigDecimal price);

    // ========== Size Partition ==========

    List<ProductSize> findSizesByProductId(Long productId);

    Optional<ProductSize> findSize(Long productId, Long sizeId);

    boolean hasSizes(Long productId);

    ProductSize saveProductSize(ProductSize productSize);

    // ========== Atomic Stock Counter ==========

    /**
     * 사이즈 구분 없는 상품의 재고 조건부 차감
     *
     * @return 반영된 행 수 (0: 재고 부족)
     */
    int decreaseStock(Long productId, int quantity);

    /**
     * 사이즈 파티션 재고 조건부 차감
     *
     * @return 반영된 행 수 (0: 재고 부족)
     */
    int decreaseSizeStock(Long productId, Long sizeId, int quantity);

    int increaseStock(Long productId, int quantity);

    int increaseSizeStock(Long productId, Long sizeId, int quantity);

    /**
     * 현재 재고 스냅샷 (영속성 컨텍스트 캐시를 거치지 않고 조회)
     */
    Optional<Integer> findCurrentStock(Long productId);

    Optional<Integer> findCurrentSizeStock(Long productId, Long sizeId);

    int sumSizeStock(Long productId);
}
