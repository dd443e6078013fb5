package com.hhplus.storefront.config;

import com.hhplus.storefront.application.order.OrderPolicy;
import com.hhplus.storefront.domain.order.OrderTransitionTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 주문 정책 설정
 *
 * storefront.order.transition-policy: standard | extended
 * storefront.order.customer-cancel-window-minutes: 고객 취소 가능 시간 (기본 30분)
 */
@Slf4j
@Configuration
public class OrderPolicyConfig {

    @Bean
    public OrderTransitionTable orderTransitionTable(
            @Value("${storefront.order.transition-policy:standard}") String policyName) {
        OrderTransitionTable table = OrderTransitionTable.forPolicy(policyName);
        log.info("[OrderPolicyConfig] 주문 상태 전이 정책: {}", table.getPolicyName());
        return table;
    }

    @Bean
    public OrderPolicy orderPolicy(OrderTransitionTable orderTransitionTable,
                                   @Value("${storefront.order.customer-cancel-window-minutes:30}") long cancelWindowMinutes) {
        return new OrderPolicy(orderTransitionTable, Duration.ofMinutes(cancelWindowMinutes));
    }

    /**
     * 주문 시각, 취소 가능 시간 계산에 쓰는 시계
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
