package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(MySQLCartRepository.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("MySQLCartRepository JPA 테스트")
class MySQLCartRepositoryTest {

    @Autowired
    private MySQLCartRepository cartRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("[회귀] 사이즈 없는 같은 상품 항목은 두 번 저장할 수 없다")
    void testUnsizedLine_UniquePerCartAndProduct() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        Long cartId = tx.execute(status -> cartRepository.findOrCreateByUserId(100L).getCartId());

        tx.executeWithoutResult(status -> cartRepository.saveLine(CartLine.createLine(cartId, 10L, null, 1)));

        assertThrows(DataIntegrityViolationException.class, () -> tx.executeWithoutResult(status ->
                cartRepository.saveLine(CartLine.createLine(cartId, 10L, null, 2))));
        assertEquals(1, cartRepository.findLines(cartId).size());
    }

    @Test
    @DisplayName("사이즈 없는 항목과 사이즈 항목은 각각 조회된다")
    void testFindLine_BySizeKey() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        Cart cart = tx.execute(status -> cartRepository.findOrCreateByUserId(200L));

        tx.executeWithoutResult(status -> {
            cartRepository.saveLine(CartLine.createLine(cart.getCartId(), 10L, null, 1));
            cartRepository.saveLine(CartLine.createLine(cart.getCartId(), 10L, 3L, 4));
        });

        assertEquals(1, cartRepository.findLine(cart.getCartId(), 10L, null).orElseThrow().getQuantity());
        assertEquals(4, cartRepository.findLine(cart.getCartId(), 10L, 3L).orElseThrow().getQuantity());
        assertTrue(cartRepository.findLine(cart.getCartId(), 10L, 4L).isEmpty());
    }
}
