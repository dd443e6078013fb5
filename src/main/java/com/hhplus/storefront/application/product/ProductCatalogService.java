package com.hhplus.storefront.application.product;

import com.hhplus.storefront.application.product.dto.ProductResponse;
import com.hhplus.storefront.application.product.dto.RegisterProductCommand;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductConstants;
import com.hhplus.storefront.domain.product.ProductNotFoundException;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductSize;
import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * ProductCatalogService - 상품 카탈로그 관리 (관리자용)
 *
 * 상품 삭제 시:
 * - 주문 항목은 상품 참조만 끊고 스냅샷(상품명, 단가)은 유지
 * - 장바구니 항목은 삭제
 * - 사이즈 파티션 재고도 함께 삭제
 */
@Slf4j
@Service
public class ProductCatalogService {

    private final ProductRepository productRepository;
    private final SizeRepository sizeRepository;
    private final OrderRepository orderRepository;
    private final CartRepository cartRepository;

    public ProductCatalogService(ProductRepository productRepository,
                                 SizeRepository sizeRepository,
                                 OrderRepository orderRepository,
                                 CartRepository cartRepository) {
        this.productRepository = productRepository;
        this.sizeRepository = sizeRepository;
        this.orderRepository = orderRepository;
        this.cartRepository = cartRepository;
    }

    @Transactional
    public ProductResponse registerProduct(RegisterProductCommand command) {
        Product saved = productRepository.save(Product.createProduct(command.getProductName(),
                command.getDescription(), command.getPrice(), command.getInitialStock()));
        log.info("[ProductCatalogService] 상품 등록: productId={}, name={}", saved.getProductId(), saved.getProductName());
        return ProductResponse.from(saved);
    }

    @Transactional
    public Size registerSize(String name, String description, int sortOrder) {
        return sizeRepository.save(Size.createSize(name, description, sortOrder));
    }

    /**
     * 상품에 사이즈 파티션 추가
     * 첫 사이즈가 추가되는 순간부터 상품은 사이즈 구분 상품으로 취급된다.
     */
    @Transactional
    public ProductSize addProductSize(Long productId, Long sizeId, int initialStock) {
        productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        Size size = sizeRepository.findById(sizeId)
                .orElseThrow(() -> new InvalidArgumentException("존재하지 않는 사이즈입니다 (sizeId=" + sizeId + ")"));
        if (productRepository.findSize(productId, sizeId).isPresent()) {
            throw new InvalidArgumentException("이미 등록된 사이즈입니다 (productId=" + productId + ", size=" + size.getName() + ")");
        }
        ProductSize saved = productRepository.saveProductSize(ProductSize.createProductSize(productId, sizeId, initialStock));
        log.info("[ProductCatalogService] 사이즈 추가: productId={}, size={}, stock={}", productId, size.getName(), initialStock);
        return saved;
    }

    /**
     * 가격 변경
     * 이미 생성된 주문의 단가에는 영향이 없고, 장바구니 합계에는 바로 반영된다.
     */
    @Transactional
    public ProductResponse changePrice(Long productId, BigDecimal newPrice) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        if (newPrice == null || newPrice.compareTo(ProductConstants.MIN_UNIT_PRICE) < 0) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_PRODUCT_PRICE + " (입력: " + newPrice + ")");
        }
        productRepository.updatePrice(product.getProductId(), Product.normalizedPrice(newPrice));
        log.info("[ProductCatalogService] 가격 변경: productId={}, price={}", productId, newPrice);
        return ProductResponse.from(productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId)));
    }

    @Transactional
    public void deleteProduct(Long productId) {
        productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        int detachedLines = orderRepository.detachProduct(productId);
        int removedCartLines = cartRepository.deleteLinesByProductId(productId);
        productRepository.deleteById(productId);

        log.info("[ProductCatalogService] 상품 삭제: productId={}, detachedOrderLines={}, removedCartLines={}",
                productId, detachedLines, removedCartLines);
    }
}
