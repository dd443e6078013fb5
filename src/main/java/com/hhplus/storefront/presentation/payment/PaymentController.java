package com.hhplus.storefront.presentation.payment;

import com.hhplus.storefront.application.payment.PaymentService;
import com.hhplus.storefront.application.payment.dto.OnlineCheckoutResponse;
import com.hhplus.storefront.application.payment.dto.PaymentVerificationResult;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.request.CreateOrderRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * PaymentController - Khalti 온라인 결제 API
 *
 * 결제 흐름:
 * 1. checkout 또는 orders로 주문 생성 + 결제 개시 → payment_url 반환
 * 2. 고객이 게이트웨이에서 결제
 * 3. 게이트웨이가 callback으로 리다이렉트 → 조회 API로 검증 후 결제 확인/취소
 */
@Slf4j
@RestController
@RequestMapping("/payments/khalti")
public class PaymentController {

    private final PaymentService paymentService;
    private final OrderMapper orderMapper;

    public PaymentController(PaymentService paymentService, OrderMapper orderMapper) {
        this.paymentService = paymentService;
        this.orderMapper = orderMapper;
    }

    /**
     * 장바구니 온라인 결제 (POST /api/payments/khalti/checkout)
     */
    @PostMapping("/checkout")
    public ResponseEntity<OnlineCheckoutResponse> checkoutCart(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CheckoutRequest request) {
        OnlineCheckoutResponse response = paymentService.checkoutCartOnline(userId, orderMapper.toCheckoutCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/orders")
    public ResponseEntity<OnlineCheckoutResponse> placeOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CreateOrderRequest request) {
        OnlineCheckoutResponse response = paymentService.placeOnlineOrder(userId, orderMapper.toCreateOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 결제 재개시 (POST /api/payments/khalti/{order_id}/initiate)
     */
    @PostMapping("/{order_id}/initiate")
    public ResponseEntity<OnlineCheckoutResponse> initiatePayment(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(paymentService.initiatePayment(orderId, userId));
    }

    /**
     * 게이트웨이 콜백 (GET /api/payments/khalti/callback?purchase_order_id=&pidx=)
     * 콜백 파라미터의 status는 신뢰하지 않고 항상 조회 API로 다시 확인한다.
     */
    @GetMapping("/callback")
    public ResponseEntity<PaymentVerificationResult> callback(
            @RequestParam("purchase_order_id") Long orderId,
            @RequestParam("pidx") String pidx) {
        log.info("[PaymentController] 결제 콜백 수신: orderId={}, pidx={}", orderId, pidx);
        return ResponseEntity.ok(paymentService.verifyPayment(orderId, pidx));
    }
}
