package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.presentation.order.request.CancelOrderRequest;
import com.hhplus.storefront.presentation.order.request.TransitionOrderRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminOrderController - 운영자 주문 관리 API
 * X-USER-ID는 운영자 ID로 이력에 기록된다.
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;

    public AdminOrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.getOrder(orderId));
    }

    /**
     * 상태 변경 (POST /api/admin/orders/{order_id}/transition)
     */
    @PostMapping("/{order_id}/transition")
    public ResponseEntity<OrderResponse> transitionOrder(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId,
            @RequestBody TransitionOrderRequest request) {
        OrderStatus status = OrderStatus.fromString(request.getStatus());
        return ResponseEntity.ok(orderService.transitionOrder(orderId, status, Actor.operator(operatorId), request.getNote()));
    }

    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId,
            @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(orderService.cancelOrder(orderId, Actor.operator(operatorId), reason, false));
    }

    /**
     * 결제 확인 (POST /api/admin/orders/{order_id}/payment)
     */
    @PostMapping("/{order_id}/payment")
    public ResponseEntity<OrderResponse> markPaid(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.markPaid(orderId, Actor.operator(operatorId)));
    }

    /**
     * 착불 결제 수령 확인 (POST /api/admin/orders/{order_id}/cod-payment)
     */
    @PostMapping("/{order_id}/cod-payment")
    public ResponseEntity<OrderResponse> confirmCashOnDeliveryPayment(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderService.confirmCashOnDeliveryPayment(orderId, Actor.operator(operatorId)));
    }

    @DeleteMapping("/{order_id}")
    public ResponseEntity<Void> deleteOrder(
            @RequestHeader("X-USER-ID") Long operatorId,
            @PathVariable("order_id") Long orderId) {
        orderService.deleteOrder(orderId, Actor.operator(operatorId));
        return ResponseEntity.noContent().build();
    }
}
