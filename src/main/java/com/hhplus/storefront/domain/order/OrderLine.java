package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderLine 도메인 엔티티
 *
 * 책임:
 * - 주문 시점의 상품명/사이즈명/단가 스냅샷 보존
 *
 * 핵심 비즈니스 규칙:
 * - 소계 = 단가 × 수량
 * - 스냅샷 필드는 생성 후 변경되지 않음 (상품 가격이 바뀌거나 상품이 삭제되어도 유지)
 * - 상품이 삭제되면 productId만 null로 끊어진다
 */
@Entity
@Table(name = "order_lines")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_line_id")
    private Long orderLineId;

    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "size_id")
    private Long sizeId;

    @Column(name = "size_name", length = 50)
    private String sizeName;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * OrderLine 생성 팩토리 메서드
     *
     * @param productName 주문 시점의 상품명 (스냅샷)
     * @param sizeName 주문 시점의 사이즈명 (사이즈 없는 상품은 null)
     * @param unitPrice 주문 시점의 단가 (스냅샷)
     */
    public static OrderLine createLine(Long productId, String productName, Long sizeId, String sizeName,
                                       BigDecimal unitPrice, int quantity) {
        if (productName == null || productName.isBlank()) {
            throw new InvalidArgumentException("상품명은 필수입니다");
        }
        if (unitPrice == null || unitPrice.signum() <= 0) {
            throw new InvalidArgumentException("단가는 0보다 커야 합니다");
        }
        if (quantity < 1) {
            throw new InvalidArgumentException("수량은 1 이상이어야 합니다 (입력: " + quantity + ")");
        }

        return OrderLine.builder()
                .productId(productId)
                .productName(productName)
                .sizeId(sizeId)
                .sizeName(sizeName)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .subtotal(unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 원본 상품 삭제 시 참조 해제
     */
    public void detachProduct() {
        this.productId = null;
    }

    /**
     * 재고를 되돌릴 원본 상품이 남아 있는지
     */
    public boolean hasProductReference() {
        return this.productId != null;
    }
}
