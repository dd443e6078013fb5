package com.hhplus.storefront.infrastructure.config.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlLogFormatter 단위 테스트")
class SqlLogFormatterTest {

    private final SqlLogFormatter formatter = new SqlLogFormatter();

    @Test
    @DisplayName("SQL 없는 카테고리는 한 줄로 출력")
    void testCommit() {
        String message = formatter.formatMessage(3, "now", 1L, "commit", "", "", "jdbc:mysql://localhost/storefront");

        assertEquals("[P6Spy] conn=3 commit (1ms)", message);
    }

    @Test
    @DisplayName("조건부 재고 차감 UPDATE는 바인딩 값과 함께 정렬되어 출력")
    void testConditionalUpdate() {
        String sql = "update products set stock = stock - 2 where product_id = 10 and stock >= 2";

        String message = formatter.formatMessage(3, "now", 4L, "statement",
                "update products set stock = stock - ? where product_id = ? and stock >= ?", sql, "url");

        assertTrue(message.startsWith("[P6Spy] conn=3 statement (4ms)"));
        assertTrue(message.contains("stock >= 2"));
        assertTrue(message.contains("\n"));
    }
}
