package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Product JPA Repository
 *
 * 재고 변경은 벌크 UPDATE 한 문장으로 처리한다.
 * WHERE 절의 "stock >= :quantity" 조건이 검사와 차감을 원자적으로 묶는다.
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    /**
     * 조건부 재고 차감
     *
     * @return 반영된 행 수 (0: 재고 부족 또는 상품 없음)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity " +
           "WHERE p.productId = :productId AND p.stock >= :quantity")
    int decreaseStock(@Param("productId") Long productId, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock + :quantity " +
           "WHERE p.productId = :productId")
    int increaseStock(@Param("productId") Long productId, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.price = :price, p.updatedAt = :updatedAt WHERE p.productId = :productId")
    int updatePrice(@Param("productId") Long productId,
                    @Param("price") BigDecimal price,
                    @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 스칼라 조회라 1차 캐시에 남은 엔티티 값이 아닌 DB의 현재 값을 읽는다.
     */
    @Query("SELECT p.stock FROM Product p WHERE p.productId = :productId")
    Optional<Integer> findStockByProductId(@Param("productId") Long productId);
}
