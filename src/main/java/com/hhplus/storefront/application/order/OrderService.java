package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.order.dto.BuyNowCommand;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.OrderLineCommand;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.application.order.dto.OrderStatusEventResponse;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.domain.cart.CartConstants;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.OrderStatusEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 유스케이스 진입점 (Application 계층)
 *
 * 역할:
 * - 주문 생성 경로 통합: 일반 주문, 장바구니 결제, 바로 구매 모두 createOrder(lines[])로 수렴
 * - 상태 변경은 OrderStatusTransactionService에 위임
 * - 조회
 *
 * 아키텍처:
 * OrderService
 *     ├─ OrderTransactionService (주문 생성 트랜잭션, @Retryable)
 *     └─ OrderStatusTransactionService (상태/결제/수령/삭제 트랜잭션, 행 락)
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderTransactionService orderTransactionService;
    private final OrderStatusTransactionService orderStatusTransactionService;
    private final OrderRepository orderRepository;
    private final OrderStatusEventRepository orderStatusEventRepository;
    private final CartService cartService;

    public OrderService(OrderTransactionService orderTransactionService,
                        OrderStatusTransactionService orderStatusTransactionService,
                        OrderRepository orderRepository,
                        OrderStatusEventRepository orderStatusEventRepository,
                        CartService cartService) {
        this.orderTransactionService = orderTransactionService;
        this.orderStatusTransactionService = orderStatusTransactionService;
        this.orderRepository = orderRepository;
        this.orderStatusEventRepository = orderStatusEventRepository;
        this.cartService = cartService;
    }

    // ========== 주문 생성 ==========

    public OrderResponse createOrder(Long userId, CreateOrderCommand command) {
        return OrderResponse.from(placeOrder(userId, command));
    }

    /**
     * 주문 생성 (커밋된 주문 엔티티 반환)
     * 온라인 결제처럼 커밋 이후 후속 작업이 필요한 경우 사용한다.
     */
    public Order placeOrder(Long userId, CreateOrderCommand command) {
        log.info("[OrderService] 주문 생성 요청: userId={}, lines={}, paymentMethod={}",
                userId, command.getLines() == null ? 0 : command.getLines().size(), command.getPaymentMethod());
        return orderTransactionService.executeTransactionalOrder(userId, command);
    }

    /**
     * 장바구니 결제
     * 주문 생성이 성공한 뒤에만 장바구니를 비운다. 실패하면 장바구니는 그대로 남는다.
     */
    public OrderResponse checkoutCart(Long userId, CheckoutCommand command) {
        Order order = placeCartOrder(userId, command);
        clearCart(userId);
        log.info("[OrderService] 장바구니 결제 완료: userId={}, orderId={}", userId, order.getOrderId());
        return OrderResponse.from(order);
    }

    /**
     * 장바구니 항목으로 주문만 생성한다. 장바구니는 호출자가 clearCart로 비운다.
     */
    public Order placeCartOrder(Long userId, CheckoutCommand command) {
        return placeOrder(userId, toCreateOrderCommand(userId, command));
    }

    public void clearCart(Long userId) {
        cartService.clear(userId);
    }

    /**
     * 바로 구매 (단일 항목, 장바구니 변경 없음)
     */
    public OrderResponse buyNow(Long userId, BuyNowCommand command) {
        return OrderResponse.from(placeOrder(userId, command.toCreateOrderCommand()));
    }

    // ========== 상태 변경 ==========

    public OrderResponse transitionOrder(Long orderId, OrderStatus newStatus, Actor actor, String note) {
        if (newStatus == null) {
            throw new InvalidArgumentException("변경할 상태는 필수입니다");
        }
        return OrderResponse.from(orderStatusTransactionService.transition(orderId, newStatus, actor, note));
    }

    public OrderResponse cancelOrder(Long orderId, Actor actor, String reason, boolean customerInitiated) {
        return OrderResponse.from(orderStatusTransactionService.cancel(orderId, actor, reason, customerInitiated));
    }

    public void deleteOrder(Long orderId, Actor actor) {
        orderStatusTransactionService.delete(orderId, actor);
    }

    public OrderResponse markPaid(Long orderId, Actor actor) {
        return OrderResponse.from(orderStatusTransactionService.markPaid(orderId, actor, null));
    }

    public OrderResponse confirmCashOnDeliveryPayment(Long orderId, Actor actor) {
        return OrderResponse.from(orderStatusTransactionService.confirmCashOnDeliveryPayment(orderId, actor));
    }

    public OrderResponse confirmReceipt(Long orderId, Long customerId) {
        return OrderResponse.from(orderStatusTransactionService.confirmReceipt(orderId, customerId));
    }

    // ========== 조회 ==========

    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId) {
        return OrderResponse.from(findOrder(orderId));
    }

    /**
     * 고객 본인 주문 조회
     */
    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId, Long userId) {
        Order order = findOrder(orderId);
        order.verifyOwner(userId);
        return OrderResponse.from(order);
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> getOrders(Long userId) {
        return orderRepository.findByUserId(userId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 상태 이력 조회
     * 삭제된 주문의 이력도 조회된다.
     */
    @Transactional(readOnly = true)
    public List<OrderStatusEventResponse> getOrderHistory(Long orderId) {
        return orderStatusEventRepository.findByOrderId(orderId).stream()
                .map(OrderStatusEventResponse::from)
                .collect(Collectors.toList());
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private CreateOrderCommand toCreateOrderCommand(Long userId, CheckoutCommand command) {
        List<CartLine> cartLines = cartService.getLines(userId);
        if (cartLines.isEmpty()) {
            throw new InvalidArgumentException(CartConstants.MSG_EMPTY_CART);
        }
        List<OrderLineCommand> lines = cartLines.stream()
                .map(line -> OrderLineCommand.builder()
                        .productId(line.getProductId())
                        .sizeId(line.getSizeId())
                        .quantity(line.getQuantity())
                        .build())
                .collect(Collectors.toList());
        return CreateOrderCommand.builder()
                .customer(command.getCustomer())
                .lines(lines)
                .paymentMethod(command.getPaymentMethod())
                .orderNotes(command.getOrderNotes())
                .build();
    }
}
