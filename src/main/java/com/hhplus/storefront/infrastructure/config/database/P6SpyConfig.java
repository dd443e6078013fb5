package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * P6Spy SQL 로그 설정
 * storefront.sql-log.enabled=true일 때만 포매터를 등록한다. (test 프로필 기본값 true)
 */
@Configuration
@ConditionalOnProperty(name = "storefront.sql-log.enabled", havingValue = "true")
public class P6SpyConfig {

    @Bean
    public MessageFormattingStrategy p6SpyMessageFormattingStrategy() {
        return new SqlLogFormatter();
    }
}
