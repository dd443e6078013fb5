package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductSize;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory Product Repository 구현
 * HashMap 기반의 인메모리 저장소 (Infrastructure 계층)
 *
 * 재고 카운터 변경은 모두 이 인스턴스의 모니터로 직렬화된다.
 * 검사와 차감이 하나의 synchronized 블록 안에서 일어나므로 동시 예약에서도 음수가 되지 않는다.
 */
@Repository
public class InMemoryProductRepository implements ProductRepository {

    private final Map<Long, Product> products = new HashMap<>();
    private final Map<Long, ProductSize> productSizes = new HashMap<>();
    private final AtomicLong productIdSequence = new AtomicLong(0);
    private final AtomicLong productSizeIdSequence = new AtomicLong(0);

    @Override
    public synchronized List<Product> findAll() {
        return new ArrayList<>(products.values());
    }

    @Override
    public synchronized Optional<Product> findById(Long productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public synchronized Product save(Product product) {
        Product saved = product.getProductId() == null
                ? product.toBuilder().productId(productIdSequence.incrementAndGet()).build()
                : product;
        products.put(saved.getProductId(), saved);
        return saved;
    }

    @Override
    public synchronized int updatePrice(Long productId, BigDecimal price) {
        Product product = products.get(productId);
        if (product == null) {
            return 0;
        }
        product.updatePrice(price);
        return 1;
    }

    @Override
    public synchronized void deleteById(Long productId) {
        products.remove(productId);
        productSizes.values().removeIf(ps -> ps.getProductId().equals(productId));
    }

    @Override
    public synchronized List<ProductSize> findSizesByProductId(Long productId) {
        return productSizes.values().stream()
                .filter(ps -> ps.getProductId().equals(productId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<ProductSize> findSize(Long productId, Long sizeId) {
        return productSizes.values().stream()
                .filter(ps -> ps.getProductId().equals(productId) && ps.getSizeId().equals(sizeId))
                .findFirst();
    }

    @Override
    public synchronized boolean hasSizes(Long productId) {
        return productSizes.values().stream().anyMatch(ps -> ps.getProductId().equals(productId));
    }

    @Override
    public synchronized ProductSize saveProductSize(ProductSize productSize) {
        ProductSize saved = productSize.getProductSizeId() == null
                ? productSize.toBuilder().productSizeId(productSizeIdSequence.incrementAndGet()).build()
                : productSize;
        productSizes.put(saved.getProductSizeId(), saved);
        return saved;
    }

    @Override
    public synchronized int decreaseStock(Long productId, int quantity) {
        Product product = products.get(productId);
        if (product == null) {
            return 0;
        }
        return product.deductStock(quantity) ? 1 : 0;
    }

    @Override
    public synchronized int decreaseSizeStock(Long productId, Long sizeId, int quantity) {
        return findSize(productId, sizeId)
                .map(ps -> ps.deductStock(quantity) ? 1 : 0)
                .orElse(0);
    }

    @Override
    public synchronized int increaseStock(Long productId, int quantity) {
        Product product = products.get(productId);
        if (product == null) {
            return 0;
        }
        product.restoreStock(quantity);
        return 1;
    }

    @Override
    public synchronized int increaseSizeStock(Long productId, Long sizeId, int quantity) {
        Optional<ProductSize> productSize = findSize(productId, sizeId);
        productSize.ifPresent(ps -> ps.restoreStock(quantity));
        return productSize.isPresent() ? 1 : 0;
    }

    @Override
    public synchronized Optional<Integer> findCurrentStock(Long productId) {
        return findById(productId).map(Product::getStock);
    }

    @Override
    public synchronized Optional<Integer> findCurrentSizeStock(Long productId, Long sizeId) {
        return findSize(productId, sizeId).map(ProductSize::getStock);
    }

    @Override
    public synchronized int sumSizeStock(Long productId) {
        return findSizesByProductId(productId).stream()
                .mapToInt(ProductSize::getStock)
                .sum();
    }

    /**
     * 테스트용: 모든 데이터 삭제
     */
    public synchronized void clear() {
        products.clear();
        productSizes.clear();
    }
}
