package com.hhplus.storefront.domain.product;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 재고 부족 예외 (409)
 *
 * 요청 수량과 남은 재고를 함께 전달한다.
 * 주문 생성 중 발생하면 몇 번째 주문 항목에서 실패했는지도 포함한다.
 */
public class InsufficientStockException extends DomainException {

    private final Long productId;
    private final Long sizeId;
    private final int requestedQuantity;
    private final int availableQuantity;
    private final Integer lineIndex;
    private final String productName;

    public InsufficientStockException(Long productId, Long sizeId, int requestedQuantity, int availableQuantity) {
        super(ErrorCode.INSUFFICIENT_STOCK, String.format("productId=%d, sizeId=%s, 요청: %d, 보유: %d",
                productId, sizeId, requestedQuantity, availableQuantity));
        this.productId = productId;
        this.sizeId = sizeId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
        this.lineIndex = null;
        this.productName = null;
    }

    private InsufficientStockException(InsufficientStockException source, int lineIndex, String productName) {
        super(ErrorCode.INSUFFICIENT_STOCK, String.format("%d번째 항목 '%s' 재고 부족 (요청: %d, 보유: %d)",
                lineIndex + 1, productName, source.requestedQuantity, source.availableQuantity));
        this.productId = source.productId;
        this.sizeId = source.sizeId;
        this.requestedQuantity = source.requestedQuantity;
        this.availableQuantity = source.availableQuantity;
        this.lineIndex = lineIndex;
        this.productName = productName;
    }

    /**
     * 주문 항목 정보를 덧붙인 예외 생성
     *
     * @param lineIndex 0부터 시작하는 주문 항목 순번
     */
    public InsufficientStockException forLine(int lineIndex, String productName) {
        return new InsufficientStockException(this, lineIndex, productName);
    }

    public Long getProductId() {
        return productId;
    }

    public Long getSizeId() {
        return sizeId;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
    }

    public Integer getLineIndex() {
        return lineIndex;
    }

    public String getProductName() {
        return productName;
    }
}
