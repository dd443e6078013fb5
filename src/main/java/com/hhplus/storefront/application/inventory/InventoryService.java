package com.hhplus.storefront.application.inventory;

import com.hhplus.storefront.application.inventory.dto.InventoryResponse;
import com.hhplus.storefront.application.inventory.dto.SizeInventoryView;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.domain.product.InsufficientStockException;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductConstants;
import com.hhplus.storefront.domain.product.ProductNotFoundException;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductSize;
import com.hhplus.storefront.domain.product.ProductSizeNotFoundException;
import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import com.hhplus.storefront.domain.product.SizeRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * InventoryService - 재고 원장 (Application 계층)
 *
 * 역할:
 * - 상품/사이즈별 가용 재고의 유일한 변경 창구
 * - reserve: 조건부 원자 차감 (재고 >= 수량일 때만)
 * - release: 무조건 원자 증가 (중복 복구 방지는 주문 상태 머신의 책임)
 * - availableQuantity: 읽기 전용 스냅샷
 *
 * 동시성:
 * - 차감은 "UPDATE ... WHERE stock >= :quantity" 단일 문장으로 처리되어
 *   같은 카운터에 대한 동시 요청이 행 락으로 직렬화된다
 * - 성공한 예약의 합은 존재했던 재고를 넘을 수 없다
 *
 * 검증 순서 (상태 변경 전):
 * 1. 수량 > 0 (InvalidArgumentException)
 * 2. 상품 존재 (ProductNotFoundException)
 * 3. 사이즈 규칙 (SizeRequiredException / InvalidArgumentException / ProductSizeNotFoundException)
 */
@Service
public class InventoryService {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final ProductRepository productRepository;
    private final SizeRepository sizeRepository;

    public InventoryService(ProductRepository productRepository, SizeRepository sizeRepository) {
        this.productRepository = productRepository;
        this.sizeRepository = sizeRepository;
    }

    /**
     * 재고 예약 (차감)
     *
     * @param sizeId 사이즈 구분 상품이면 필수, 아니면 null
     * @throws InsufficientStockException 재고 부족 (상태 변경 없음)
     */
    @Transactional
    public void reserve(Long productId, Long sizeId, int quantity) {
        validateQuantity(quantity);
        boolean partitioned = resolvePartitioning(productId, sizeId);

        int updated = partitioned
                ? productRepository.decreaseSizeStock(productId, sizeId, quantity)
                : productRepository.decreaseStock(productId, quantity);

        if (updated == 0) {
            int available = currentQuantity(productId, sizeId, partitioned);
            log.info("[InventoryService] 재고 부족: productId={}, sizeId={}, requested={}, available={}",
                    productId, sizeId, quantity, available);
            throw new InsufficientStockException(productId, sizeId, quantity, available);
        }

        log.debug("[InventoryService] 재고 예약: productId={}, sizeId={}, quantity={}", productId, sizeId, quantity);
    }

    /**
     * 재고 반환 (증가)
     * 주문 취소, 주문 삭제, 예약 보상에서 호출된다.
     */
    @Transactional
    public void release(Long productId, Long sizeId, int quantity) {
        validateQuantity(quantity);
        boolean partitioned = resolvePartitioning(productId, sizeId);

        int updated = partitioned
                ? productRepository.increaseSizeStock(productId, sizeId, quantity)
                : productRepository.increaseStock(productId, quantity);

        if (updated == 0) {
            throw partitioned
                    ? new ProductSizeNotFoundException(productId, sizeId)
                    : new ProductNotFoundException(productId);
        }

        log.info("[InventoryService] 재고 반환 완료: productId={}, sizeId={}, quantity={}", productId, sizeId, quantity);
    }

    /**
     * 관리자 재고 보정 (입고)
     */
    @Transactional
    public void restock(Long productId, Long sizeId, int quantity, String operator) {
        release(productId, sizeId, quantity);
        log.info("[InventoryService] 관리자 재고 보정: productId={}, sizeId={}, quantity=+{}, operator={}",
                productId, sizeId, quantity, operator);
    }

    /**
     * 가용 재고 조회
     * 사이즈 구분 상품에 sizeId 없이 조회하면 전체 파티션 합계를 반환한다.
     */
    @Transactional(readOnly = true)
    public int availableQuantity(Long productId, Long sizeId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        boolean partitioned = productRepository.hasSizes(product.getProductId());

        if (partitioned && sizeId == null) {
            return productRepository.sumSizeStock(productId);
        }
        if (!partitioned && sizeId != null) {
            throw new InvalidArgumentException(ProductConstants.MSG_SIZE_NOT_PARTITIONED + " (productId=" + productId + ")");
        }
        return currentQuantity(productId, sizeId, partitioned);
    }

    /**
     * 상품 재고 현황 조회 (사이즈별, sortOrder 순)
     */
    @Transactional(readOnly = true)
    public InventoryResponse getInventory(Long productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        List<ProductSize> productSizes = productRepository.findSizesByProductId(productId);
        if (productSizes.isEmpty()) {
            int stock = productRepository.findCurrentStock(productId).orElse(0);
            return InventoryResponse.unpartitioned(product, stock);
        }

        Map<Long, Size> sizes = sizeRepository.findAllOrdered().stream()
                .collect(Collectors.toMap(Size::getSizeId, Function.identity()));

        List<SizeInventoryView> views = productSizes.stream()
                .map(ps -> SizeInventoryView.from(ps, sizes.get(ps.getSizeId())))
                .sorted(Comparator.comparing(SizeInventoryView::getSortOrder))
                .collect(Collectors.toList());

        return InventoryResponse.partitioned(product, views);
    }

    /**
     * 사이즈 규칙 검증
     *
     * @return 사이즈 파티션 재고를 사용해야 하면 true
     */
    private boolean resolvePartitioning(Long productId, Long sizeId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        boolean partitioned = productRepository.hasSizes(productId);

        if (partitioned && sizeId == null) {
            throw new SizeRequiredException(productId, product.getProductName());
        }
        if (!partitioned && sizeId != null) {
            throw new InvalidArgumentException(ProductConstants.MSG_SIZE_NOT_PARTITIONED + " (productId=" + productId + ")");
        }
        if (partitioned && productRepository.findSize(productId, sizeId).isEmpty()) {
            throw new ProductSizeNotFoundException(productId, sizeId);
        }
        return partitioned;
    }

    private int currentQuantity(Long productId, Long sizeId, boolean partitioned) {
        if (partitioned) {
            return productRepository.findCurrentSizeStock(productId, sizeId)
                    .orElseThrow(() -> new ProductSizeNotFoundException(productId, sizeId));
        }
        return productRepository.findCurrentStock(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private void validateQuantity(int quantity) {
        if (quantity < ProductConstants.MIN_RESERVE_QUANTITY) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_QUANTITY + " (입력: " + quantity + ")");
        }
    }
}
