package com.hhplus.storefront.domain.cart;

/**
 * 장바구니 수량 규칙과 메시지
 */
public final class CartConstants {

    public static final int MIN_CART_QUANTITY = 1;
    public static final int MAX_CART_QUANTITY = 1000;

    public static final String MSG_INVALID_QUANTITY_RANGE =
            String.format("장바구니 수량은 %d~%d 범위여야 합니다", MIN_CART_QUANTITY, MAX_CART_QUANTITY);

    /** 사이즈 없는 항목의 size_key (사이즈 ID는 1부터 발급) */
    public static final Long NO_SIZE_KEY = 0L;

    /** 장바구니 결제 시 담긴 항목이 없을 때 */
    public static final String MSG_EMPTY_CART = "결제할 장바구니 항목이 없습니다";

    private CartConstants() {
        throw new AssertionError("Cannot instantiate CartConstants");
    }
}
