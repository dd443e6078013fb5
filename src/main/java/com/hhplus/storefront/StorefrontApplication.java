package com.hhplus.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Storefront 주문/재고 엔진 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 알림 비동기 전송
 * - @EnableRetry: 주문 생성 트랜잭션의 락 실패 재시도
 * - @EnableAspectJAutoProxy: AOP Aspect 자동 프록시 생성
 */
@EnableAsync
@EnableRetry
@EnableAspectJAutoProxy
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
