package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * CartLine 도메인 엔티티
 *
 * 장바구니의 라인 항목. (cart, product, size) 조합당 하나만 존재한다.
 * 단가는 저장하지 않는다. 장바구니 합계는 항상 현재 상품 가격으로 계산한다.
 *
 * 유일 키는 nullable인 size_id 대신 size_key를 쓴다.
 * MySQL 유니크 인덱스는 NULL끼리 중복으로 보지 않으므로, 사이즈 없는 항목은 size_key = 0으로 저장한다.
 */
@Entity
@Table(name = "cart_lines", uniqueConstraints = {
    @UniqueConstraint(name = "uk_cart_line", columnNames = {"cart_id", "product_id", "size_key"})
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CartLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_line_id")
    private Long cartLineId;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "size_id")
    private Long sizeId;

    @Column(name = "size_key", nullable = false, updatable = false)
    private Long sizeKey;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static CartLine createLine(Long cartId, Long productId, Long sizeId, int quantity) {
        validateQuantity(quantity);
        LocalDateTime now = LocalDateTime.now();
        return CartLine.builder()
                .cartId(cartId)
                .productId(productId)
                .sizeId(sizeId)
                .sizeKey(sizeKeyOf(sizeId))
                .quantity(quantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Long sizeKeyOf(Long sizeId) {
        return sizeId == null ? CartConstants.NO_SIZE_KEY : sizeId;
    }

    /**
     * 같은 (상품, 사이즈) 재추가 시 수량 병합
     */
    public void mergeQuantity(int additional) {
        validateQuantity(additional);
        changeQuantity(this.quantity + additional);
    }

    public void changeQuantity(int newQuantity) {
        validateQuantity(newQuantity);
        this.quantity = newQuantity;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean matches(Long productId, Long sizeId) {
        return this.productId.equals(productId) && Objects.equals(this.sizeId, sizeId);
    }

    private static void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidArgumentException(CartConstants.MSG_INVALID_QUANTITY_RANGE + " (입력: " + quantity + ")");
        }
    }
}
