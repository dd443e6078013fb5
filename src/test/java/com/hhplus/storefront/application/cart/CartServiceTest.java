package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.cart.dto.AddCartLineCommand;
import com.hhplus.storefront.application.cart.dto.CartLineResponse;
import com.hhplus.storefront.application.cart.dto.CartLineUpdateResult;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.config.InMemoryOrderContext;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartLineConflictException;
import com.hhplus.storefront.domain.cart.CartLineNotFoundException;
import com.hhplus.storefront.domain.product.InsufficientStockException;
import com.hhplus.storefront.domain.product.SizeRequiredException;
import com.hhplus.storefront.infrastructure.persistence.cart.InMemoryCartRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long USER_ID = 1L;

    private InMemoryOrderContext context;
    private CartService cartService;

    @BeforeEach
    void setup() {
        context = new InMemoryOrderContext();
        cartService = context.cartService;
    }

    @Test
    @DisplayName("같은 상품을 다시 담으면 수량이 합쳐진다")
    void testAddLine_Merge() {
        Long productId = context.product("머그컵", "5.50", 10);

        cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 2));
        CartLineResponse merged = cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 3));

        assertEquals(5, merged.getQuantity());
        assertEquals(1, cartService.getCart(USER_ID).getLines().size());
    }

    @Test
    @DisplayName("합친 수량이 재고를 넘으면 실패, 장바구니는 그대로")
    void testAddLine_MergeExceedsStock() {
        Long productId = context.product("머그컵", "5.50", 4);
        cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 3));

        assertThrows(InsufficientStockException.class,
                () -> cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 2)));

        assertEquals(3, cartService.getCart(USER_ID).getLines().get(0).getQuantity());
        assertEquals(4, context.stock(productId));
    }

    @Test
    @DisplayName("사이즈 구분 상품은 사이즈 없이 담을 수 없다")
    void testAddLine_SizeRequired() {
        Long productId = context.product("티셔츠", "19.99", 0);
        Long sizeM = context.size("M", 2);
        context.addSize(productId, sizeM, 3);

        assertThrows(SizeRequiredException.class,
                () -> cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 1)));

        CartLineResponse line = cartService.addLine(USER_ID, new AddCartLineCommand(productId, sizeM, 1));
        assertEquals("M", line.getSizeName());
    }

    @Test
    @DisplayName("수량 변경 - 가용 재고를 넘으면 가용 재고로 조정")
    void testUpdateLineQuantity_Clamped() {
        Long productId = context.product("머그컵", "5.50", 3);
        CartLineResponse line = cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 1));

        CartLineUpdateResult result = cartService.updateLineQuantity(USER_ID, line.getCartLineId(), 10);

        assertTrue(result.isClamped());
        assertEquals(10, result.getRequestedQuantity());
        assertEquals(3, result.getAppliedQuantity());
        assertEquals(3, result.getLine().getQuantity());
    }

    @Test
    @DisplayName("다른 사용자의 장바구니 항목은 변경할 수 없다")
    void testUpdateLineQuantity_OtherUser() {
        Long productId = context.product("머그컵", "5.50", 3);
        CartLineResponse line = cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 1));
        context.cartRepository.findOrCreateByUserId(2L);

        assertThrows(CartLineNotFoundException.class,
                () -> cartService.updateLineQuantity(2L, line.getCartLineId(), 2));
        assertThrows(CartLineNotFoundException.class,
                () -> cartService.removeLine(2L, line.getCartLineId()));
    }

    @Test
    @DisplayName("합계는 현재 가격 기준으로 계산된다")
    void testTotal_UsesCurrentPrice() {
        Long productId = context.product("머그컵", "5.50", 10);
        cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 2));
        assertEquals(0, new BigDecimal("11.00").compareTo(cartService.total(USER_ID)));

        context.productCatalogService.changePrice(productId, new BigDecimal("7.00"));

        CartResponse cart = cartService.getCart(USER_ID);
        assertEquals(0, new BigDecimal("14.00").compareTo(cart.getTotalAmount()));
        assertEquals(2, cart.getTotalQuantity());
    }

    @Test
    @DisplayName("장바구니에 담아도 재고는 줄지 않는다")
    void testAddLine_DoesNotReserve() {
        Long productId = context.product("머그컵", "5.50", 10);

        cartService.addLine(USER_ID, new AddCartLineCommand(productId, null, 4));

        assertEquals(10, context.stock(productId));
    }

    @Test
    @DisplayName("같은 항목이 동시에 처음 담겨 유일 키에 걸리면 409 충돌 예외로 바꾼다")
    void testAddLine_ConcurrentInsertConflict() {
        Long productId = context.product("머그컵", "5.50", 10);
        InMemoryCartRepository conflictingRepository = new InMemoryCartRepository() {
            @Override
            public CartLine saveLine(CartLine cartLine) {
                if (cartLine.getCartLineId() == null) {
                    throw new DataIntegrityViolationException("Duplicate entry for key 'uk_cart_line'");
                }
                return super.saveLine(cartLine);
            }
        };
        CartService service = new CartService(conflictingRepository, context.productRepository,
                context.sizeRepository, context.inventoryService);

        CartLineConflictException e = assertThrows(CartLineConflictException.class,
                () -> service.addLine(USER_ID, new AddCartLineCommand(productId, null, 1)));

        assertEquals(ErrorCode.CART_LINE_CONFLICT, e.getErrorCode());
        assertInstanceOf(DataIntegrityViolationException.class, e.getCause());
    }
}
