package com.hhplus.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Cart 도메인 엔티티
 * 사용자별 장바구니. 항목(CartLine)은 cart_id로 연결된다.
 */
@Entity
@Table(name = "carts")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart createCart(Long userId) {
        LocalDateTime now = LocalDateTime.now();
        return Cart.builder()
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
