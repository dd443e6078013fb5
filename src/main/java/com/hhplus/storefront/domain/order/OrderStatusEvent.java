package com.hhplus.storefront.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * OrderStatusEvent 엔티티 (주문 상태 감사 로그)
 *
 * append-only: 생성 후 수정/삭제하지 않는다.
 * 상태 전이, 결제 확인, 수령 확인마다 1건씩 기록된다.
 * 주문이 삭제되어도 남는다. (orders 테이블과 FK 없음)
 */
@Entity
@Table(name = "order_status_events", indexes = {
    @Index(name = "idx_order_status_events_order_id", columnList = "order_id")
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OrderStatusEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_id")
    private Long eventId;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 30)
    private OrderStatus status;

    @Embedded
    private Actor actor;

    @Column(name = "note", length = 500, updatable = false)
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static OrderStatusEvent of(Long orderId, OrderStatus status, Actor actor, String note, LocalDateTime occurredAt) {
        return OrderStatusEvent.builder()
                .orderId(orderId)
                .status(status)
                .actor(actor)
                .note(note)
                .createdAt(occurredAt)
                .build();
    }
}
