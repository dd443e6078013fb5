package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.application.order.dto.OrderStatusEventResponse;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.request.BuyNowRequest;
import com.hhplus.storefront.presentation.order.request.CancelOrderRequest;
import com.hhplus.storefront.presentation.order.request.CheckoutRequest;
import com.hhplus.storefront.presentation.order.request.CreateOrderRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OrderController - 고객 주문 API
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * 주문 생성 (POST /api/orders)
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CreateOrderRequest request) {
        OrderResponse response = orderService.createOrder(userId, orderMapper.toCreateOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 장바구니 결제 (POST /api/orders/checkout)
     */
    @PostMapping("/checkout")
    public ResponseEntity<OrderResponse> checkoutCart(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody CheckoutRequest request) {
        OrderResponse response = orderService.checkoutCart(userId, orderMapper.toCheckoutCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 바로 구매 (POST /api/orders/buy-now)
     */
    @PostMapping("/buy-now")
    public ResponseEntity<OrderResponse> buyNow(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody BuyNowRequest request) {
        OrderResponse response = orderService.buyNow(userId, orderMapper.toBuyNowCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(orderService.getOrders(userId));
    }

    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId, userId));
    }

    /**
     * 주문 상태 이력 (GET /api/orders/{order_id}/history)
     */
    @GetMapping("/{order_id}/history")
    public ResponseEntity<List<OrderStatusEventResponse>> getOrderHistory(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        orderService.getOrder(orderId, userId);
        return ResponseEntity.ok(orderService.getOrderHistory(orderId));
    }

    /**
     * 고객 주문 취소 (POST /api/orders/{order_id}/cancel)
     * 주문 후 설정된 시간 이내, 발송 전 상태에서만 가능
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(orderService.cancelOrder(orderId, Actor.customer(userId), reason, true));
    }

    /**
     * 수령 확인 (POST /api/orders/{order_id}/receipt)
     */
    @PostMapping("/{order_id}/receipt")
    public ResponseEntity<OrderResponse> confirmReceipt(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.confirmReceipt(orderId, userId));
    }
}
