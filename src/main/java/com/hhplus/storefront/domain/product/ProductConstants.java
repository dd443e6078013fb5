package com.hhplus.storefront.domain.product;

import java.math.BigDecimal;

/**
 * ProductConstants - 상품/재고 도메인 상수
 *
 * 사용 예:
 * - if (price.compareTo(ProductConstants.MIN_UNIT_PRICE) < 0) throw ...
 */
public final class ProductConstants {

    private ProductConstants() {
        throw new AssertionError("Cannot instantiate ProductConstants");
    }

    // ========== Price Constants ==========

    /** 최소 단가 (0.01) */
    public static final BigDecimal MIN_UNIT_PRICE = new BigDecimal("0.01");

    /** 가격 소수점 자릿수 */
    public static final int PRICE_SCALE = 2;

    // ========== Stock Constants ==========

    /** 재고 최소값 (음수 불가) */
    public static final int MIN_STOCK = 0;

    /** 예약/복구 최소 수량 */
    public static final int MIN_RESERVE_QUANTITY = 1;

    // ========== Validation Messages ==========

    public static final String MSG_PRODUCT_NAME_REQUIRED = "상품명은 필수입니다";
    public static final String MSG_INVALID_PRODUCT_PRICE = "상품 가격은 0.01 이상이어야 합니다";
    public static final String MSG_NEGATIVE_STOCK = "재고는 0 이상이어야 합니다";
    public static final String MSG_INVALID_QUANTITY = "수량은 1 이상이어야 합니다";
    public static final String MSG_SIZE_NOT_PARTITIONED = "사이즈 구분이 없는 상품에 사이즈가 지정되었습니다";
}
