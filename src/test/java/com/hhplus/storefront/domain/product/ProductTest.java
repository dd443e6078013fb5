package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Product 도메인 테스트")
class ProductTest {

    @Test
    @DisplayName("상품 생성 - 가격은 소수 둘째 자리로 맞춘다")
    void testCreateProduct() {
        Product product = Product.createProduct("티셔츠", "면 100%", new BigDecimal("19.999"), 5);

        assertEquals(new BigDecimal("20.00"), product.getPrice());
        assertEquals(5, product.getStock());
    }

    @Test
    @DisplayName("상품 생성 - 0.01 미만 가격, 음수 재고는 거절")
    void testCreateProduct_Invalid() {
        assertThrows(InvalidArgumentException.class,
                () -> Product.createProduct("티셔츠", null, new BigDecimal("0.001"), 1));
        assertThrows(InvalidArgumentException.class,
                () -> Product.createProduct("티셔츠", null, BigDecimal.ONE, -1));
        assertThrows(InvalidArgumentException.class,
                () -> Product.createProduct(" ", null, BigDecimal.ONE, 1));
    }

    @Test
    @DisplayName("재고 차감 - 부족하면 false, 재고 변화 없음")
    void testDeductStock() {
        Product product = Product.createProduct("티셔츠", null, BigDecimal.TEN, 3);

        assertTrue(product.deductStock(3));
        assertFalse(product.deductStock(1));
        assertEquals(0, product.getStock());

        product.restoreStock(2);
        assertEquals(2, product.getStock());
    }

    @Test
    @DisplayName("저장 시 가격 보정 - 0.01 미만은 0.01로 올림")
    void testNormalizePrice() {
        Product product = Product.builder().productName("샘플").price(new BigDecimal("0.00")).stock(0).build();

        product.normalizePrice();

        assertEquals(new BigDecimal("0.01"), product.getPrice());
    }

    @Test
    @DisplayName("사이즈 재고 - 차감 실패 시 상태 유지")
    void testProductSizeStock() {
        ProductSize productSize = ProductSize.createProductSize(1L, 2L, 1);

        assertTrue(productSize.deductStock(1));
        assertFalse(productSize.hasStock());
        assertFalse(productSize.deductStock(1));
        assertEquals(0, productSize.getStock());
    }
}
