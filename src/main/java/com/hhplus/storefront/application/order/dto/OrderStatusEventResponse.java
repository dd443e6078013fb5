package com.hhplus.storefront.application.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.order.ActorType;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.OrderStatusEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 주문 상태 이력 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusEventResponse {
    @JsonProperty("event_id")
    private Long eventId;

    @JsonProperty("status")
    private OrderStatus status;

    @JsonProperty("actor_type")
    private ActorType actorType;

    @JsonProperty("actor_id")
    private Long actorId;

    @JsonProperty("note")
    private String note;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static OrderStatusEventResponse from(OrderStatusEvent event) {
        return OrderStatusEventResponse.builder()
                .eventId(event.getEventId())
                .status(event.getStatus())
                .actorType(event.getActor().getActorType())
                .actorId(event.getActor().getActorId())
                .note(event.getNote())
                .createdAt(event.getCreatedAt())
                .build();
    }
}
