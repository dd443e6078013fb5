package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.ProductSize;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * ProductSize JPA Repository
 */
public interface ProductSizeJpaRepository extends JpaRepository<ProductSize, Long> {

    List<ProductSize> findByProductId(Long productId);

    Optional<ProductSize> findByProductIdAndSizeId(Long productId, Long sizeId);

    boolean existsByProductId(Long productId);

    void deleteByProductId(Long productId);

    /**
     * 사이즈 파티션 조건부 재고 차감
     *
     * @return 반영된 행 수 (0: 재고 부족 또는 파티션 없음)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductSize ps SET ps.stock = ps.stock - :quantity " +
           "WHERE ps.productId = :productId AND ps.sizeId = :sizeId AND ps.stock >= :quantity")
    int decreaseStock(@Param("productId") Long productId,
                      @Param("sizeId") Long sizeId,
                      @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductSize ps SET ps.stock = ps.stock + :quantity " +
           "WHERE ps.productId = :productId AND ps.sizeId = :sizeId")
    int increaseStock(@Param("productId") Long productId,
                      @Param("sizeId") Long sizeId,
                      @Param("quantity") int quantity);

    @Query("SELECT ps.stock FROM ProductSize ps WHERE ps.productId = :productId AND ps.sizeId = :sizeId")
    Optional<Integer> findStock(@Param("productId") Long productId, @Param("sizeId") Long sizeId);

    @Query("SELECT COALESCE(SUM(ps.stock), 0) FROM ProductSize ps WHERE ps.productId = :productId")
    long sumStockByProductId(@Param("productId") Long productId);
}
