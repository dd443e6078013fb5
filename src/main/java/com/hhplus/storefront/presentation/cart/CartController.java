package com.hhplus.storefront.presentation.cart;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.cart.dto.AddCartLineCommand;
import com.hhplus.storefront.application.cart.dto.CartLineResponse;
import com.hhplus.storefront.application.cart.dto.CartLineUpdateResult;
import com.hhplus.storefront.application.cart.dto.CartResponse;
import com.hhplus.storefront.presentation.cart.request.AddCartLineRequest;
import com.hhplus.storefront.presentation.cart.request.UpdateCartLineRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - 장바구니 API
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartService.getCart(userId));
    }

    @PostMapping("/lines")
    public ResponseEntity<CartLineResponse> addLine(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody AddCartLineRequest request) {
        AddCartLineCommand command = new AddCartLineCommand(request.getProductId(), request.getSizeId(), request.getQuantity());
        return ResponseEntity.status(HttpStatus.CREATED).body(cartService.addLine(userId, command));
    }

    /**
     * 수량 변경 (PUT /api/carts/lines/{line_id})
     * 가용 재고를 넘는 수량은 가용 재고로 조정되며 clamped=true로 응답한다.
     */
    @PutMapping("/lines/{line_id}")
    public ResponseEntity<CartLineUpdateResult> updateLineQuantity(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("line_id") Long lineId,
            @RequestBody UpdateCartLineRequest request) {
        return ResponseEntity.ok(cartService.updateLineQuantity(userId, lineId, request.getQuantity()));
    }

    @DeleteMapping("/lines/{line_id}")
    public ResponseEntity<Void> removeLine(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("line_id") Long lineId) {
        cartService.removeLine(userId, lineId);
        return ResponseEntity.noContent().build();
    }
}
