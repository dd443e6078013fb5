package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductSize;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * 재고 차감/복구는 JPQL 벌크 UPDATE로 위임한다.
 * 벌크 연산은 영속성 컨텍스트를 거치지 않으므로 현재 재고는 스칼라 쿼리로 읽는다.
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;
    private final ProductSizeJpaRepository productSizeJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository,
                                  ProductSizeJpaRepository productSizeJpaRepository) {
        this.productJpaRepository = productJpaRepository;
        this.productSizeJpaRepository = productSizeJpaRepository;
    }

    @Override
    public List<Product> findAll() {
        return productJpaRepository.findAll();
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    @Transactional
    public void deleteById(Long productId) {
        productSizeJpaRepository.deleteByProductId(productId);
        productJpaRepository.deleteById(productId);
    }

    @Override
    public List<ProductSize> findSizesByProductId(Long productId) {
        return productSizeJpaRepository.findByProductId(productId);
    }

    @Override
    public Optional<ProductSize> findSize(Long productId, Long sizeId) {
        return productSizeJpaRepository.findByProductIdAndSizeId(productId, sizeId);
    }

    @Override
    public boolean hasSizes(Long productId) {
        return productSizeJpaRepository.existsByProductId(productId);
    }

    @Override
    public ProductSize saveProductSize(ProductSize productSize) {
        return productSizeJpaRepository.save(productSize);
    }

    @Override
    public int decreaseStock(Long productId, int quantity) {
        return productJpaRepository.decreaseStock(productId, quantity);
    }

    @Override
    public int decreaseSizeStock(Long productId, Long sizeId, int quantity) {
        return productSizeJpaRepository.decreaseStock(productId, sizeId, quantity);
    }

    @Override
    public int updatePrice(Long productId, BigDecimal price) {
        return productJpaRepository.updatePrice(productId, price, LocalDateTime.now());
    }

    @Override
    public int increaseStock(Long productId, int quantity) {
        return productJpaRepository.increaseStock(productId, quantity);
    }

    @Override
    public int increaseSizeStock(Long productId, Long sizeId, int quantity) {
        return productSizeJpaRepository.increaseStock(productId, sizeId, quantity);
    }

    @Override
    public Optional<Integer> findCurrentStock(Long productId) {
        return productJpaRepository.findStockByProductId(productId);
    }

    @Override
    public Optional<Integer> findCurrentSizeStock(Long productId, Long sizeId) {
        return productSizeJpaRepository.findStock(productId, sizeId);
    }

    @Override
    public int sumSizeStock(Long productId) {
        return Math.toIntExact(productSizeJpaRepository.sumStockByProductId(productId));
    }
}
