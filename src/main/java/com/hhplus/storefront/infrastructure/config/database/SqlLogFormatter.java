package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy SQL 로그 포매터
 *
 * - 바인딩 값이 채워진 SQL을 한 건씩 출력
 * - DDL은 FormatStyle.DDL, 재고 차감 같은 DML/조회는 FormatStyle.BASIC으로 정렬
 * - commit/rollback 같은 SQL 없는 카테고리는 한 줄로 출력
 */
public class SqlLogFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return String.format("[P6Spy] conn=%d %s (%dms)", connectionId, category, elapsed);
        }
        return String.format("[P6Spy] conn=%d %s (%dms)%s", connectionId, category, elapsed, prettify(sql.trim()));
    }

    private String prettify(String sql) {
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("drop")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }
}
