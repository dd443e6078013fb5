package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 정보 및 단가 관리
 * - 사이즈 구분이 없는 상품의 단일 재고 관리
 *
 * 핵심 비즈니스 규칙:
 * - 단가는 최소 단위(0.01) 미만이 될 수 없음 (저장 시점에 보정)
 * - 재고는 음수가 될 수 없음
 * - 사이즈 구분 상품은 ProductSize의 재고 합계가 전체 재고이며, stock 컬럼은 사용하지 않음
 *
 * 엔티티 저장 시 변경된 컬럼만 UPDATE 한다. (@DynamicUpdate)
 * stock은 조건부 UPDATE로만 바뀌므로, 영속성 컨텍스트에 남은 이전 재고 값이 덮어쓰지 않는다.
 */
@Entity
@DynamicUpdate
@Table(name = "products")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "description")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명은 필수
     * - 가격은 0.01 이상
     * - 초기 재고는 0 이상 (사이즈 구분 상품은 0으로 생성)
     */
    public static Product createProduct(String productName, String description, BigDecimal price, int initialStock) {
        if (productName == null || productName.isBlank()) {
            throw new InvalidArgumentException(ProductConstants.MSG_PRODUCT_NAME_REQUIRED);
        }
        if (price == null || price.compareTo(ProductConstants.MIN_UNIT_PRICE) < 0) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_PRODUCT_PRICE + " (입력: " + price + ")");
        }
        if (initialStock < ProductConstants.MIN_STOCK) {
            throw new InvalidArgumentException(ProductConstants.MSG_NEGATIVE_STOCK);
        }

        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .productName(productName)
                .description(description)
                .price(price.setScale(ProductConstants.PRICE_SCALE, RoundingMode.HALF_UP))
                .stock(initialStock)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 재고 차감 (사이즈 구분 없는 상품)
     *
     * @return 차감 성공 여부 (재고 부족 시 false, 상태 변경 없음)
     */
    public boolean deductStock(int quantity) {
        if (quantity <= 0) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_QUANTITY + " (입력: " + quantity + ")");
        }
        if (this.stock < quantity) {
            return false;
        }
        this.stock -= quantity;
        this.updatedAt = LocalDateTime.now();
        return true;
    }

    /**
     * 재고 복구 (취소/삭제/관리자 보정)
     */
    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_QUANTITY + " (입력: " + quantity + ")");
        }
        this.stock += quantity;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 가격 변경
     * 이미 생성된 주문의 단가 스냅샷에는 영향을 주지 않는다.
     */
    public void updatePrice(BigDecimal newPrice) {
        if (newPrice == null) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_PRODUCT_PRICE);
        }
        this.price = newPrice;
        normalizePrice();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 저장 시점 가격 보정: 0.01 미만이면 0.01로 올린다.
     */
    @PrePersist
    @PreUpdate
    void normalizePrice() {
        this.price = normalizedPrice(this.price);
    }

    public static BigDecimal normalizedPrice(BigDecimal price) {
        if (price == null || price.compareTo(ProductConstants.MIN_UNIT_PRICE) < 0) {
            return ProductConstants.MIN_UNIT_PRICE.setScale(ProductConstants.PRICE_SCALE, RoundingMode.HALF_UP);
        }
        return price.setScale(ProductConstants.PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
