package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.cart.dto.AddCartLineCommand;
import com.hhplus.storefront.application.cart.dto.CartLineResponse;
import com.hhplus.storefront.application.cart.dto.CartLineUpdateResult;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.application.inventory.InventoryService;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartConstants;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartLineConflictException;
import com.hhplus.storefront.domain.cart.CartLineNotFoundException;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.product.InsufficientStockException;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductNotFoundException;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import com.hhplus.storefront.domain.product.SizeRequiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartService - 장바구니 (Application 계층)
 *
 * 특징:
 * - 재고는 읽기 전용으로만 확인한다. 실제 예약은 주문 생성 시점에 일어난다.
 * - 합계는 항상 현재 상품 가격으로 계산한다. (주문과 달리 가격을 고정하지 않음)
 * - (상품, 사이즈) 조합이 같으면 기존 항목에 수량을 합친다.
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final SizeRepository sizeRepository;
    private final InventoryService inventoryService;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository,
                       SizeRepository sizeRepository,
                       InventoryService inventoryService) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.sizeRepository = sizeRepository;
        this.inventoryService = inventoryService;
    }

    /**
     * 사용자의 장바구니 조회
     */
    @Transactional(readOnly = true)
    public CartResponse getCart(Long userId) {
        Optional<Cart> cart = cartRepository.findByUserId(userId);
        List<CartLine> lines = cart.map(c -> cartRepository.findLines(c.getCartId())).orElse(List.of());

        List<CartLineResponse> lineResponses = lines.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());

        return CartResponse.builder()
                .cartId(cart.map(Cart::getCartId).orElse(null))
                .userId(userId)
                .totalQuantity(lineResponses.stream().mapToInt(CartLineResponse::getQuantity).sum())
                .totalAmount(sumSubtotals(lineResponses))
                .lines(lineResponses)
                .build();
    }

    /**
     * 장바구니 항목 추가
     *
     * 1. 사이즈 구분 상품인데 사이즈가 없으면 SizeRequiredException
     * 2. 기존 (상품, 사이즈) 항목이 있으면 병합 후 수량으로 재고 검증
     * 3. 요청 수량이 가용 재고를 넘으면 InsufficientStockException (장바구니 변경 없음)
     */
    @Transactional
    public CartLineResponse addLine(Long userId, AddCartLineCommand command) {
        validateQuantity(command.getQuantity());

        Product product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(command.getProductId()));
        if (command.getSizeId() == null && productRepository.hasSizes(product.getProductId())) {
            throw new SizeRequiredException(product.getProductId(), product.getProductName());
        }

        Cart cart = cartRepository.findOrCreateByUserId(userId);
        Optional<CartLine> existing = cartRepository.findLine(cart.getCartId(), command.getProductId(), command.getSizeId());
        int mergedQuantity = existing.map(CartLine::getQuantity).orElse(0) + command.getQuantity();

        int available = inventoryService.availableQuantity(command.getProductId(), command.getSizeId());
        if (mergedQuantity > available) {
            throw new InsufficientStockException(command.getProductId(), command.getSizeId(), mergedQuantity, available);
        }

        CartLine saved;
        if (existing.isPresent()) {
            CartLine line = existing.get();
            line.mergeQuantity(command.getQuantity());
            saved = cartRepository.saveLine(line);
        } else {
            saved = insertLine(CartLine.createLine(cart.getCartId(), command.getProductId(), command.getSizeId(), command.getQuantity()));
        }

        log.info("[CartService] 장바구니 추가: userId={}, productId={}, sizeId={}, quantity={}",
                userId, saved.getProductId(), saved.getSizeId(), saved.getQuantity());
        return toResponse(saved);
    }

    private CartLine insertLine(CartLine line) {
        try {
            return cartRepository.saveLine(line);
        } catch (DataIntegrityViolationException e) {
            log.warn("[CartService] 장바구니 항목 동시 생성 충돌: cartId={}, productId={}, sizeId={}",
                    line.getCartId(), line.getProductId(), line.getSizeId());
            throw new CartLineConflictException(line.getCartId(), line.getProductId(), line.getSizeId(), e);
        }
    }

    /**
     * 장바구니 수량 변경
     *
     * 요청 수량이 가용 재고를 넘으면 실패하지 않고 가용 재고로 맞춘다.
     * 가용 재고가 0이면 맞출 수량이 없으므로 InsufficientStockException.
     */
    @Transactional
    public CartLineUpdateResult updateLineQuantity(Long userId, Long cartLineId, int quantity) {
        validateQuantity(quantity);
        CartLine line = findOwnedLine(userId, cartLineId);

        int available = inventoryService.availableQuantity(line.getProductId(), line.getSizeId());
        if (available < CartConstants.MIN_CART_QUANTITY) {
            throw new InsufficientStockException(line.getProductId(), line.getSizeId(), quantity, available);
        }

        int applied = Math.min(quantity, available);
        line.changeQuantity(applied);
        CartLine saved = cartRepository.saveLine(line);

        boolean clamped = applied < quantity;
        if (clamped) {
            log.info("[CartService] 수량 조정: cartLineId={}, requested={}, applied={}", cartLineId, quantity, applied);
        }

        return CartLineUpdateResult.builder()
                .line(toResponse(saved))
                .requestedQuantity(quantity)
                .appliedQuantity(applied)
                .clamped(clamped)
                .build();
    }

    @Transactional
    public void removeLine(Long userId, Long cartLineId) {
        findOwnedLine(userId, cartLineId);
        cartRepository.deleteLine(cartLineId);
    }

    /**
     * 장바구니 합계 (현재 가격 기준)
     */
    @Transactional(readOnly = true)
    public BigDecimal total(Long userId) {
        return getCart(userId).getTotalAmount();
    }

    /**
     * 장바구니 항목 조회 (주문 생성용)
     */
    @Transactional(readOnly = true)
    public List<CartLine> getLines(Long userId) {
        return cartRepository.findByUserId(userId)
                .map(cart -> cartRepository.findLines(cart.getCartId()))
                .orElse(List.of());
    }

    /**
     * 장바구니 비우기
     * 주문 생성이 성공한 뒤에만 호출한다.
     */
    @Transactional
    public void clear(Long userId) {
        cartRepository.findByUserId(userId)
                .ifPresent(cart -> cartRepository.deleteLines(cart.getCartId()));
    }

    private CartLine findOwnedLine(Long userId, Long cartLineId) {
        CartLine line = cartRepository.findLineById(cartLineId)
                .orElseThrow(() -> new CartLineNotFoundException(cartLineId));
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartLineNotFoundException(cartLineId));
        if (!line.getCartId().equals(cart.getCartId())) {
            throw new CartLineNotFoundException(cartLineId);
        }
        return line;
    }

    private CartLineResponse toResponse(CartLine line) {
        Product product = productRepository.findById(line.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(line.getProductId()));
        String sizeName = line.getSizeId() == null ? null
                : sizeRepository.findById(line.getSizeId()).map(Size::getName).orElse(null);
        return CartLineResponse.from(line, product, sizeName);
    }

    private BigDecimal sumSubtotals(List<CartLineResponse> lines) {
        return lines.stream()
                .map(CartLineResponse::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidArgumentException(CartConstants.MSG_INVALID_QUANTITY_RANGE + " (입력: " + quantity + ")");
        }
    }
}
