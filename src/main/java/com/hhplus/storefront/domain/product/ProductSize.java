package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

/**
 * ProductSize 도메인 엔티티 (사이즈별 재고 파티션)
 *
 * 책임:
 * - (상품, 사이즈) 조합의 가용 재고 관리
 *
 * 핵심 비즈니스 규칙:
 * - 재고는 음수가 될 수 없음 (>= 0)
 * - 차감은 보유 재고 이하일 때만 성공하며, 실패 시 상태를 바꾸지 않음
 * - (product_id, size_id) 조합은 유일
 */
@Entity
@DynamicUpdate
@Table(name = "product_sizes",
        uniqueConstraints = @UniqueConstraint(name = "uk_product_size", columnNames = {"product_id", "size_id"}))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProductSize {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_size_id")
    private Long productSizeId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "size_id", nullable = false)
    private Long sizeId;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ProductSize createProductSize(Long productId, Long sizeId, int initialStock) {
        if (productId == null || sizeId == null) {
            throw new InvalidArgumentException("상품 ID와 사이즈 ID는 필수입니다");
        }
        if (initialStock < ProductConstants.MIN_STOCK) {
            throw new InvalidArgumentException(ProductConstants.MSG_NEGATIVE_STOCK);
        }
        return ProductSize.builder()
                .productId(productId)
                .sizeId(sizeId)
                .stock(initialStock)
                .updatedAt(LocalDateTime.now())
                .build();
    }

    /**
     * 재고 차감
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

    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new InvalidArgumentException(ProductConstants.MSG_INVALID_QUANTITY + " (입력: " + quantity + ")");
        }
        this.stock += quantity;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean hasStock() {
        return this.stock > ProductConstants.MIN_STOCK;
    }
}
