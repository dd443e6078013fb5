package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CartLine 도메인 테스트")
class CartLineTest {

    @Test
    @DisplayName("같은 (상품, 사이즈) 항목은 수량을 합친다")
    void testMergeQuantity() {
        CartLine line = CartLine.createLine(1L, 10L, 3L, 2);

        line.mergeQuantity(3);

        assertEquals(5, line.getQuantity());
        assertTrue(line.matches(10L, 3L));
        assertFalse(line.matches(10L, null));
    }

    @Test
    @DisplayName("수량 범위를 벗어나면 거절")
    void testQuantityRange() {
        assertThrows(InvalidArgumentException.class, () -> CartLine.createLine(1L, 10L, null, 0));
        assertThrows(InvalidArgumentException.class,
                () -> CartLine.createLine(1L, 10L, null, CartConstants.MAX_CART_QUANTITY + 1));

        CartLine line = CartLine.createLine(1L, 10L, null, CartConstants.MAX_CART_QUANTITY);
        assertThrows(InvalidArgumentException.class, () -> line.mergeQuantity(1));
        assertEquals(CartConstants.MAX_CART_QUANTITY, line.getQuantity());
    }

    @Test
    @DisplayName("사이즈 없는 항목은 size_key 0, 사이즈 있는 항목은 사이즈 ID를 유일 키로 쓴다")
    void testSizeKey() {
        CartLine unsized = CartLine.createLine(1L, 10L, null, 1);
        CartLine sized = CartLine.createLine(1L, 10L, 3L, 1);

        assertNull(unsized.getSizeId());
        assertEquals(CartConstants.NO_SIZE_KEY, unsized.getSizeKey());
        assertEquals(3L, sized.getSizeKey());
    }
}
