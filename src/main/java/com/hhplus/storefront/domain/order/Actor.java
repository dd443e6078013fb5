package com.hhplus.storefront.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 상태 변경 주체 (Value Object)
 * SYSTEM은 actorId가 없다.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Actor {

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, length = 20)
    private ActorType actorType;

    @Column(name = "actor_id")
    private Long actorId;

    public static Actor system() {
        return new Actor(ActorType.SYSTEM, null);
    }

    public static Actor operator(Long operatorId) {
        return new Actor(ActorType.OPERATOR, operatorId);
    }

    public static Actor customer(Long userId) {
        return new Actor(ActorType.CUSTOMER, userId);
    }

    public boolean isCustomer() {
        return actorType == ActorType.CUSTOMER;
    }
}
