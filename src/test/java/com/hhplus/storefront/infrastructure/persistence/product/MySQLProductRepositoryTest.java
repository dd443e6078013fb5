package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MySQLProductRepositoryTest - JPA 슬라이스 테스트 (내장 DB)
 *
 * 엔티티를 읽어 둔 트랜잭션 도중 다른 트랜잭션이 재고를 차감해도,
 * 엔티티 저장이 이전 재고 값으로 덮어쓰지 않는지 검증한다.
 * 트랜잭션 경계를 직접 나누기 위해 테스트 트랜잭션은 끈다.
 */
@DataJpaTest
@Import(MySQLProductRepository.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("MySQLProductRepository JPA 테스트")
class MySQLProductRepositoryTest {

    @Autowired
    private MySQLProductRepository productRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate tx;
    private TransactionTemplate newTx;

    @BeforeEach
    void setup() {
        tx = new TransactionTemplate(transactionManager);
        newTx = new TransactionTemplate(transactionManager);
        newTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Test
    @DisplayName("[회귀] 가격 변경 엔티티 저장이 그 사이 커밋된 재고 차감을 되돌리지 않는다")
    void testEntitySave_DoesNotOverwriteConcurrentReservation() {
        Long productId = tx.execute(status ->
                productRepository.save(Product.createProduct("머그컵", null, new BigDecimal("5.50"), 5)).getProductId());

        tx.executeWithoutResult(status -> {
            Product product = productRepository.findById(productId).orElseThrow();
            assertEquals(5, product.getStock());

            Integer reserved = newTx.execute(inner -> productRepository.decreaseStock(productId, 5));
            assertEquals(1, reserved);

            product.updatePrice(new BigDecimal("12.00"));
            productRepository.save(product);
        });

        assertEquals(0, productRepository.findCurrentStock(productId).orElseThrow());
        assertEquals(new BigDecimal("12.00"), productRepository.findById(productId).orElseThrow().getPrice());
    }

    @Test
    @DisplayName("[회귀] 단가 UPDATE는 재고 컬럼을 건드리지 않는다")
    void testUpdatePrice_KeepsStock() {
        Long productId = tx.execute(status ->
                productRepository.save(Product.createProduct("머그컵", null, new BigDecimal("5.50"), 5)).getProductId());

        tx.executeWithoutResult(status -> {
            productRepository.findById(productId).orElseThrow();
            newTx.executeWithoutResult(inner -> productRepository.decreaseStock(productId, 2));
            assertEquals(1, productRepository.updatePrice(productId, new BigDecimal("7.25")));
        });

        assertEquals(3, productRepository.findCurrentStock(productId).orElseThrow());
        assertEquals(new BigDecimal("7.25"), productRepository.findById(productId).orElseThrow().getPrice());
    }

    @Test
    @DisplayName("조건부 차감 - 보유 재고를 넘는 요청은 0행 반영, 재고 유지")
    void testDecreaseStock_Conditional() {
        Long productId = tx.execute(status ->
                productRepository.save(Product.createProduct("머그컵", null, new BigDecimal("5.50"), 2)).getProductId());

        Integer updated = tx.execute(status -> productRepository.decreaseStock(productId, 3));

        assertEquals(0, updated);
        assertEquals(2, productRepository.findCurrentStock(productId).orElseThrow());
    }
}
