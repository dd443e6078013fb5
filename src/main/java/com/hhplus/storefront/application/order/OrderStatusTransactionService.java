package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.inventory.InventoryService;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.InvalidOrderStateException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderLine;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.OrderStatusEvent;
import com.hhplus.storefront.domain.order.OrderStatusEventRepository;
import com.hhplus.storefront.domain.order.OrderTransitionTable;
import com.hhplus.storefront.domain.order.PaymentMethod;
import com.hhplus.storefront.domain.order.event.OrderDeletedEvent;
import com.hhplus.storefront.domain.order.event.OrderPaymentConfirmedEvent;
import com.hhplus.storefront.domain.order.event.OrderReceiptConfirmedEvent;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * OrderStatusTransactionService - 주문 상태 변경 트랜잭션 (Application 계층)
 *
 * 모든 작업은 주문 행을 배타 락으로 조회한 뒤 수행한다. (findByIdForUpdate)
 * 같은 주문에 대한 동시 취소/전이는 직렬화되며, 두 번째 요청은 전이표 검증에서 거절된다.
 *
 * 재고 반환 규칙:
 * - CANCELLED로 전이되는 순간 1회만 반환
 * - 취소되지 않은 주문의 삭제는 취소와 같은 반환을 한 번 수행
 * - 상품이 삭제되어 참조가 끊어진 항목은 반환하지 않음
 */
@Service
public class OrderStatusTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderStatusTransactionService.class);

    private final OrderRepository orderRepository;
    private final OrderStatusEventRepository orderStatusEventRepository;
    private final InventoryService inventoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final OrderPolicy orderPolicy;
    private final Clock clock;

    public OrderStatusTransactionService(OrderRepository orderRepository,
                                         OrderStatusEventRepository orderStatusEventRepository,
                                         InventoryService inventoryService,
                                         ApplicationEventPublisher eventPublisher,
                                         OrderPolicy orderPolicy,
                                         Clock clock) {
        this.orderRepository = orderRepository;
        this.orderStatusEventRepository = orderStatusEventRepository;
        this.inventoryService = inventoryService;
        this.eventPublisher = eventPublisher;
        this.orderPolicy = orderPolicy;
        this.clock = clock;
    }

    /**
     * 상태 전이
     * CANCELLED로의 전이는 취소 절차(재고 반환 포함)로 처리한다.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order transition(Long orderId, OrderStatus nextStatus, Actor actor, String note) {
        Order order = lockOrder(orderId);
        if (nextStatus == OrderStatus.CANCELLED) {
            order.ensureCancellableByOperator(table());
            String reason = note != null ? note : OrderConstants.REASON_CANCELLED_BY_OPERATOR;
            return applyCancellation(order, reason, actor);
        }

        LocalDateTime now = now();
        OrderStatus previous = order.transitionTo(nextStatus, table(), now);
        Order saved = orderRepository.save(order);

        recordEvent(saved, actor, note, now);
        eventPublisher.publishEvent(new OrderStatusChangedEvent(saved.getOrderId(), saved.getUserId(),
                previous, nextStatus, note));

        log.info("[OrderStatusTransactionService] 상태 전이: orderId={}, {} -> {}, actor={}",
                orderId, previous, nextStatus, actor.getActorType());
        return saved;
    }

    /**
     * 주문 취소
     *
     * @param customerInitiated true면 소유자 확인 + 취소 가능 시간/상태 검증
     */
    @Transactional(rollbackFor = Exception.class)
    public Order cancel(Long orderId, Actor actor, String reason, boolean customerInitiated) {
        Order order = lockOrder(orderId);
        if (customerInitiated) {
            order.verifyOwner(actor.getActorId());
            order.ensureCancellableByCustomer(now(), orderPolicy.getCustomerCancelWindow());
        } else {
            order.ensureCancellableByOperator(table());
        }

        String effectiveReason = reason;
        if (effectiveReason == null || effectiveReason.isBlank()) {
            effectiveReason = customerInitiated
                    ? OrderConstants.REASON_CANCELLED_BY_CUSTOMER
                    : OrderConstants.REASON_CANCELLED_BY_OPERATOR;
        }
        return applyCancellation(order, effectiveReason, actor);
    }

    /**
     * 결제 확인 (멱등)
     * 상태는 바꾸지 않는다. 이미 확인된 주문이면 아무것도 기록하지 않는다.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order markPaid(Long orderId, Actor actor, String note) {
        Order order = lockOrder(orderId);
        if (order.isCancelled()) {
            throw new InvalidOrderStateException(orderId, "취소된 주문은 결제 확인할 수 없습니다");
        }
        LocalDateTime now = now();
        if (!order.markPaid(now)) {
            log.debug("[OrderStatusTransactionService] 이미 결제 확인된 주문: orderId={}", orderId);
            return order;
        }
        Order saved = orderRepository.save(order);

        recordEvent(saved, actor, note != null ? note : OrderConstants.NOTE_PAYMENT_CONFIRMED, now);
        eventPublisher.publishEvent(new OrderPaymentConfirmedEvent(saved.getOrderId(), saved.getUserId(),
                saved.getPaymentMethod(), saved.getTotalAmount()));

        log.info("[OrderStatusTransactionService] 결제 확인: orderId={}, method={}", orderId, saved.getPaymentMethod());
        return saved;
    }

    /**
     * 착불(COD) 결제 수령 확인
     * 배송 완료된 착불 주문에 대해서만 허용한다.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order confirmCashOnDeliveryPayment(Long orderId, Actor actor) {
        Order order = lockOrder(orderId);
        if (order.getPaymentMethod() != PaymentMethod.CASH_ON_DELIVERY) {
            throw new InvalidOrderStateException(orderId, "착불 주문이 아닙니다. 결제 수단: " + order.getPaymentMethod());
        }
        if (order.getOrderStatus() != OrderStatus.DELIVERED) {
            throw new InvalidOrderStateException(orderId,
                    "배송 완료된 착불 주문만 결제 수령을 확인할 수 있습니다. 현재 상태: " + order.getOrderStatus());
        }
        return markPaid(orderId, actor, OrderConstants.NOTE_COD_PAYMENT_RECEIVED);
    }

    /**
     * 온라인 결제 검증 완료
     * 결제 확인 플래그를 세우고 결제 확인 후 상태(standard: PROCESSING, extended: CONFIRMED)로 전이한다.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order confirmOnlinePayment(Long orderId, String note) {
        Order order = markPaid(orderId, Actor.system(), note != null ? note : OrderConstants.NOTE_ONLINE_PAYMENT_VERIFIED);
        if (order.getOrderStatus() != OrderStatus.PENDING) {
            return order;
        }
        return transition(orderId, table().paymentConfirmedStatus(), Actor.system(),
                OrderConstants.NOTE_ONLINE_PAYMENT_VERIFIED);
    }

    /**
     * 결제 게이트웨이 거래 식별자 기록
     * 게이트웨이 호출이 끝난 뒤 별도 트랜잭션으로 저장한다. 그 사이 취소된 주문이면 거절한다.
     */
    @Transactional(rollbackFor = Exception.class)
    public Order assignPaymentReference(Long orderId, String transactionRef) {
        Order order = lockOrder(orderId);
        if (order.getOrderStatus() != OrderStatus.PENDING || order.isPaymentConfirmed()) {
            throw new InvalidOrderStateException(orderId,
                    "결제 대기 중인 주문에만 결제 거래를 연결할 수 있습니다. 현재 상태: " + order.getOrderStatus());
        }
        order.assignPaymentReference(transactionRef);
        return orderRepository.save(order);
    }

    /**
     * 고객 수령 확인
     */
    @Transactional(rollbackFor = Exception.class)
    public Order confirmReceipt(Long orderId, Long customerId) {
        Order order = lockOrder(orderId);
        order.verifyOwner(customerId);

        LocalDateTime now = now();
        order.confirmReceipt(now);
        Order saved = orderRepository.save(order);

        recordEvent(saved, Actor.customer(customerId), OrderConstants.NOTE_RECEIPT_CONFIRMED, now);
        eventPublisher.publishEvent(new OrderReceiptConfirmedEvent(saved.getOrderId(), saved.getUserId(),
                saved.getReceivedAt()));

        log.info("[OrderStatusTransactionService] 수령 확인: orderId={}, customerId={}", orderId, customerId);
        return saved;
    }

    /**
     * 주문 삭제
     *
     * 취소되지 않은 주문은 상태와 무관하게(DELIVERED 포함) 재고를 반환하고,
     * CANCELLED 이력 한 건을 남긴 뒤 삭제한다. 알림 이벤트는 OrderDeletedEvent 하나만 발행한다.
     * 이미 CANCELLED인 주문은 재고 반환, 이력, 이벤트 없이 레코드만 지운다.
     * 상태 이력은 주문과 별도로 남는다.
     */
    @Transactional(rollbackFor = Exception.class)
    public void delete(Long orderId, Actor actor) {
        Order order = lockOrder(orderId);
        if (order.isCancelled()) {
            orderRepository.delete(order);
            log.info("[OrderStatusTransactionService] 취소된 주문 삭제: orderId={}", orderId);
            return;
        }

        OrderStatus previous = order.getOrderStatus();
        releaseLines(order);
        orderStatusEventRepository.append(OrderStatusEvent.of(order.getOrderId(), OrderStatus.CANCELLED,
                actor, OrderConstants.REASON_DELETED_BY_STORE, now()));
        orderRepository.delete(order);
        eventPublisher.publishEvent(new OrderDeletedEvent(order.getOrderId(), order.getUserId()));

        log.info("[OrderStatusTransactionService] 주문 삭제: orderId={}, previous={}, actor={}",
                orderId, previous, actor.getActorType());
    }

    private Order applyCancellation(Order order, String reason, Actor actor) {
        LocalDateTime now = now();
        OrderStatus previous = order.cancel(reason, table(), now);

        releaseLines(order);
        Order saved = orderRepository.save(order);

        recordEvent(saved, actor, reason, now);
        eventPublisher.publishEvent(new OrderStatusChangedEvent(saved.getOrderId(), saved.getUserId(),
                previous, OrderStatus.CANCELLED, reason));

        log.info("[OrderStatusTransactionService] 주문 취소: orderId={}, previous={}, reason={}, actor={}",
                saved.getOrderId(), previous, reason, actor.getActorType());
        return saved;
    }

    private void releaseLines(Order order) {
        for (OrderLine line : order.getOrderLines()) {
            if (line.hasProductReference()) {
                inventoryService.release(line.getProductId(), line.getSizeId(), line.getQuantity());
            } else {
                log.info("[OrderStatusTransactionService] 삭제된 상품 항목은 재고 반환 생략: orderId={}, orderLineId={}",
                        order.getOrderId(), line.getOrderLineId());
            }
        }
    }

    private void recordEvent(Order order, Actor actor, String note, LocalDateTime now) {
        orderStatusEventRepository.append(OrderStatusEvent.of(order.getOrderId(), order.getOrderStatus(),
                actor, note, now));
    }

    private Order lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private OrderTransitionTable table() {
        return orderPolicy.getTransitionTable();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
