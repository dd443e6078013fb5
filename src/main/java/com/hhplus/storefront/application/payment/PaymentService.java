package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.application.order.OrderService;
import com.hhplus.storefront.application.order.OrderStatusTransactionService;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.CustomerInfoCommand;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.application.payment.dto.OnlineCheckoutResponse;
import com.hhplus.storefront.application.payment.dto.PaymentInitiation;
import com.hhplus.storefront.application.payment.dto.PaymentInitiationRequest;
import com.hhplus.storefront.application.payment.dto.PaymentLookup;
import com.hhplus.storefront.application.payment.dto.PaymentVerificationResult;
import com.hhplus.storefront.application.payment.dto.PaymentVerificationResult.Outcome;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.InvalidOrderStateException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * PaymentService - 온라인 결제 확인 (Application 계층)
 *
 * 역할:
 * - 온라인 결제 주문 생성: 주문 생성 트랜잭션이 커밋된 뒤 트랜잭션 밖에서 결제를 개시한다
 *   게이트웨이 실패(시간 초과/거절) 시 주문은 취소 절차로 보상되어 예약 재고가 반환된다
 * - 결제 검증: 게이트웨이 조회 결과에 따라 결제 확인 / 취소 / 유지
 *
 * 게이트웨이 호출 중에는 재고 행 락도, 주문 행 락도 잡고 있지 않는다.
 *
 * 검증 결과 처리:
 * - 완료 + 금액 일치 → 결제 확인 + 결제 후 상태로 전이
 * - 실패 확정 상태, 금액 불일치, 게이트웨이 거절 → 주문 취소 (재고 1회 반환)
 * - 진행 중 상태 → 변경 없음
 * - 시간 초과 → 변경 없음, PaymentGatewayTimeoutException 전파
 */
@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final OrderService orderService;
    private final OrderStatusTransactionService orderStatusTransactionService;
    private final OrderRepository orderRepository;
    private final PaymentGateway paymentGateway;
    private final Duration gatewayTimeout;

    public PaymentService(OrderService orderService,
                          OrderStatusTransactionService orderStatusTransactionService,
                          OrderRepository orderRepository,
                          PaymentGateway paymentGateway,
                          @Value("${payment.khalti.timeout-seconds:30}") long gatewayTimeoutSeconds) {
        this.orderService = orderService;
        this.orderStatusTransactionService = orderStatusTransactionService;
        this.orderRepository = orderRepository;
        this.paymentGateway = paymentGateway;
        this.gatewayTimeout = Duration.ofSeconds(gatewayTimeoutSeconds);
    }

    /**
     * 온라인 결제 주문 (주문 항목 직접 지정)
     */
    public OnlineCheckoutResponse placeOnlineOrder(Long userId, CreateOrderCommand command) {
        CreateOrderCommand onlineCommand = CreateOrderCommand.builder()
                .customer(command.getCustomer())
                .lines(command.getLines())
                .paymentMethod(resolveOnlineMethod(command.getPaymentMethod()))
                .orderNotes(command.getOrderNotes())
                .build();
        validateContactDetails(onlineCommand.getCustomer());

        Order order = orderService.placeOrder(userId, onlineCommand);
        return startPayment(order);
    }

    /**
     * 온라인 결제 주문 (장바구니)
     * 결제 개시까지 성공해야 장바구니가 비워진다.
     */
    public OnlineCheckoutResponse checkoutCartOnline(Long userId, CheckoutCommand command) {
        CheckoutCommand onlineCommand = CheckoutCommand.builder()
                .customer(command.getCustomer())
                .paymentMethod(resolveOnlineMethod(command.getPaymentMethod()))
                .orderNotes(command.getOrderNotes())
                .build();
        validateContactDetails(onlineCommand.getCustomer());

        Order order = orderService.placeCartOrder(userId, onlineCommand);
        OnlineCheckoutResponse response = startPayment(order);
        orderService.clearCart(userId);
        return response;
    }

    /**
     * 기존 미결제 주문의 결제 재개시
     * 실패해도 주문은 취소하지 않는다. 고객이 다시 시도할 수 있다.
     */
    public OnlineCheckoutResponse initiatePayment(Long orderId, Long userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        order.verifyOwner(userId);
        if (!order.getPaymentMethod().isOnline()) {
            throw new InvalidOrderStateException(orderId, "온라인 결제 주문이 아닙니다. 결제 수단: " + order.getPaymentMethod());
        }
        if (order.getOrderStatus() != OrderStatus.PENDING || order.isPaymentConfirmed()) {
            throw new InvalidOrderStateException(orderId,
                    "결제 대기 중인 주문만 결제를 개시할 수 있습니다. 현재 상태: " + order.getOrderStatus());
        }

        PaymentInitiation initiation = initiate(order);
        Order saved = orderStatusTransactionService.assignPaymentReference(orderId, initiation.getTransactionRef());
        return toCheckoutResponse(saved, initiation);
    }

    /**
     * 결제 검증 (게이트웨이 콜백)
     *
     * @param transactionRef 게이트웨이 거래 식별자 (Khalti pidx)
     * @throws PaymentGatewayTimeoutException 조회 시간 초과. 주문은 변경되지 않는다
     */
    public PaymentVerificationResult verifyPayment(Long orderId, String transactionRef) {
        if (transactionRef == null || transactionRef.isBlank()) {
            throw new InvalidArgumentException("결제 거래 식별자는 필수입니다");
        }
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.getPaymentMethod().isOnline()) {
            throw new InvalidOrderStateException(orderId, "온라인 결제 주문이 아닙니다. 결제 수단: " + order.getPaymentMethod());
        }
        if (order.getPaymentReference() == null) {
            throw new InvalidOrderStateException(orderId, "결제가 개시되지 않은 주문입니다");
        }
        if (!order.getPaymentReference().equals(transactionRef)) {
            throw new InvalidArgumentException("주문의 결제 거래 식별자와 일치하지 않습니다 (orderId=" + orderId + ")");
        }
        if (order.isPaymentConfirmed()) {
            return PaymentVerificationResult.of(order, Outcome.ALREADY_VERIFIED, null, null);
        }
        if (order.isCancelled()) {
            return PaymentVerificationResult.of(order, Outcome.CANCELLED, null, order.getCancellationReason());
        }
        if (order.getOrderStatus() != OrderStatus.PENDING) {
            throw new InvalidOrderStateException(orderId,
                    "결제 대기 중인 주문만 검증할 수 있습니다. 현재 상태: " + order.getOrderStatus());
        }

        PaymentLookup lookup;
        try {
            lookup = paymentGateway.lookup(transactionRef, gatewayTimeout);
        } catch (PaymentGatewayTimeoutException e) {
            log.warn("[PaymentService] 결제 조회 시간 초과, 주문 유지: orderId={}, transactionRef={}", orderId, transactionRef);
            throw e;
        } catch (PaymentGatewayRejectedException e) {
            log.warn("[PaymentService] 결제 조회 거절, 주문 취소: orderId={}, remoteStatus={}", orderId, e.getRemoteStatus());
            Order cancelled = cancelForPayment(orderId, OrderConstants.REASON_PAYMENT_GATEWAY_REJECTED);
            return PaymentVerificationResult.of(cancelled, Outcome.CANCELLED, null,
                    OrderConstants.REASON_PAYMENT_GATEWAY_REJECTED);
        }

        if (lookup.getStatus().isCompleted()) {
            long expected = PaymentInitiationRequest.toMinorUnits(order.getTotalAmount());
            if (lookup.getAmountMinor() != expected) {
                String reason = String.format("%s (주문: %d, 결제: %d)",
                        OrderConstants.REASON_PAYMENT_AMOUNT_MISMATCH, expected, lookup.getAmountMinor());
                log.warn("[PaymentService] 결제 금액 불일치: orderId={}, expected={}, paid={}",
                        orderId, expected, lookup.getAmountMinor());
                Order cancelled = cancelForPayment(orderId, reason);
                return PaymentVerificationResult.of(cancelled, Outcome.CANCELLED, lookup.getStatus(), reason);
            }
            Order confirmed = orderStatusTransactionService.confirmOnlinePayment(orderId,
                    OrderConstants.NOTE_ONLINE_PAYMENT_VERIFIED + " (" + transactionRef + ")");
            log.info("[PaymentService] 결제 검증 완료: orderId={}, transactionRef={}", orderId, transactionRef);
            return PaymentVerificationResult.of(confirmed, Outcome.VERIFIED, lookup.getStatus(), null);
        }

        if (lookup.getStatus().isFailure()) {
            String reason = OrderConstants.REASON_PAYMENT_FAILED + " (" + lookup.getStatus().getGatewayValue() + ")";
            Order cancelled = cancelForPayment(orderId, reason);
            return PaymentVerificationResult.of(cancelled, Outcome.CANCELLED, lookup.getStatus(), reason);
        }

        log.info("[PaymentService] 결제 진행 중, 주문 유지: orderId={}, gatewayStatus={}", orderId, lookup.getStatus());
        return PaymentVerificationResult.of(order, Outcome.PENDING, lookup.getStatus(), null);
    }

    /**
     * 커밋된 주문의 결제 개시
     * 게이트웨이 실패 시 주문을 취소(재고 반환 + 이력)한 뒤 원래 예외를 전파한다.
     */
    private OnlineCheckoutResponse startPayment(Order order) {
        PaymentInitiation initiation;
        try {
            initiation = initiate(order);
        } catch (RuntimeException e) {
            log.warn("[PaymentService] 결제 개시 실패, 주문 취소: orderId={}, reason={}", order.getOrderId(), e.getMessage());
            compensate(order.getOrderId(), e);
            throw e;
        }
        Order saved = orderStatusTransactionService.assignPaymentReference(order.getOrderId(), initiation.getTransactionRef());
        return toCheckoutResponse(saved, initiation);
    }

    private void compensate(Long orderId, RuntimeException cause) {
        try {
            cancelForPayment(orderId, OrderConstants.REASON_PAYMENT_INITIATION_FAILED);
        } catch (RuntimeException cancelFailure) {
            log.error("[PaymentService] 결제 개시 실패 보상 취소 실패: orderId={}", orderId, cancelFailure);
            cause.addSuppressed(cancelFailure);
        }
    }

    private PaymentInitiation initiate(Order order) {
        if (order.getTotalAmount().signum() <= 0) {
            throw new InvalidArgumentException("결제 금액은 0보다 커야 합니다 (orderId=" + order.getOrderId() + ")");
        }
        if (!order.getCustomerInfo().hasContactDetails()) {
            throw new InvalidArgumentException("결제에 필요한 주문자 정보(이름, 이메일, 연락처)가 없습니다");
        }
        PaymentInitiation initiation = paymentGateway.initiate(PaymentInitiationRequest.forOrder(order), gatewayTimeout);
        log.info("[PaymentService] 결제 개시: orderId={}, transactionRef={}", order.getOrderId(), initiation.getTransactionRef());
        return initiation;
    }

    private Order cancelForPayment(Long orderId, String reason) {
        return orderStatusTransactionService.cancel(orderId, Actor.system(), reason, false);
    }

    private PaymentMethod resolveOnlineMethod(PaymentMethod requested) {
        PaymentMethod method = requested == null ? PaymentMethod.KHALTI : requested;
        if (!method.isOnline()) {
            throw new InvalidArgumentException("온라인 결제 수단이 아닙니다: " + method);
        }
        return method;
    }

    /**
     * 네트워크 호출 전 로컬 검증
     */
    private void validateContactDetails(CustomerInfoCommand customer) {
        if (customer == null || !customer.toCustomerInfo().hasContactDetails()) {
            throw new InvalidArgumentException("결제에 필요한 주문자 정보(이름, 이메일, 연락처)가 없습니다");
        }
    }

    private OnlineCheckoutResponse toCheckoutResponse(Order order, PaymentInitiation initiation) {
        return OnlineCheckoutResponse.builder()
                .order(OrderResponse.from(order))
                .paymentUrl(initiation.getPaymentUrl())
                .transactionRef(initiation.getTransactionRef())
                .build();
    }
}
