package com.hhplus.storefront.application.payment;

import com.hhplus.storefront.application.cart.dto.AddCartLineCommand;
import com.hhplus.storefront.application.order.dto.CheckoutCommand;
import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.application.payment.dto.OnlineCheckoutResponse;
import com.hhplus.storefront.application.payment.dto.PaymentGatewayStatus;
import com.hhplus.storefront.application.payment.dto.PaymentInitiation;
import com.hhplus.storefront.application.payment.dto.PaymentInitiationRequest;
import com.hhplus.storefront.application.payment.dto.PaymentLookup;
import com.hhplus.storefront.application.payment.dto.PaymentVerificationResult;
import com.hhplus.storefront.application.payment.dto.PaymentVerificationResult.Outcome;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.config.InMemoryOrderContext;
import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.order.InvalidOrderStateException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.PaymentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static com.hhplus.storefront.config.TestDataFactory.line;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * PaymentServiceTest - 온라인 결제 단위 테스트
 *
 * 게이트웨이는 Mock, 주문/재고는 인메모리 구성
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentService 단위 테스트")
class PaymentServiceTest {

    private static final Long USER_ID = 1L;
    private static final String PIDX = "bZQLD9wRVWo4CdESSfuSsB";

    @Mock
    private PaymentGateway paymentGateway;

    private InMemoryOrderContext context;
    private PaymentService paymentService;
    private Long mugId;

    @BeforeEach
    void setup() {
        context = new InMemoryOrderContext();
        paymentService = new PaymentService(context.orderService, context.orderStatusTransactionService,
                context.orderRepository, paymentGateway, 5L);
        mugId = context.product("머그컵", "5.50", 3);
    }

    @Test
    @DisplayName("온라인 주문 - 결제 개시 후 payment_url, pidx 반환 + 주문에 거래 식별자 저장")
    void testPlaceOnlineOrder() {
        when(paymentGateway.initiate(any(), any())).thenReturn(initiation());

        OnlineCheckoutResponse response = paymentService.placeOnlineOrder(USER_ID, khaltiOrder(2));

        assertEquals("https://test-pay.khalti.com/?pidx=" + PIDX, response.getPaymentUrl());
        assertEquals(PIDX, response.getTransactionRef());
        assertEquals(OrderStatus.PENDING, response.getOrder().getOrderStatus());
        Order saved = context.orderRepository.findById(response.getOrder().getOrderId()).orElseThrow();
        assertEquals(PIDX, saved.getPaymentReference());
        assertEquals(1, context.stock(mugId));

        ArgumentCaptor<PaymentInitiationRequest> captor = ArgumentCaptor.forClass(PaymentInitiationRequest.class);
        verify(paymentGateway).initiate(captor.capture(), eq(Duration.ofSeconds(5)));
        assertEquals(1100L, captor.getValue().getAmountMinor());
        assertEquals(String.valueOf(saved.getOrderId()), captor.getValue().getPurchaseOrderId());
    }

    @Test
    @DisplayName("결제 개시는 주문이 저장되고 재고가 예약된 뒤에 호출된다")
    void testPlaceOnlineOrder_InitiatesAfterOrderPersisted() {
        when(paymentGateway.initiate(any(), any())).thenAnswer(invocation -> {
            PaymentInitiationRequest request = invocation.getArgument(0);
            Order persisted = context.orderRepository.findById(Long.valueOf(request.getPurchaseOrderId())).orElseThrow();
            assertEquals(OrderStatus.PENDING, persisted.getOrderStatus());
            assertNull(persisted.getPaymentReference());
            assertEquals(1, context.stock(mugId));
            return initiation();
        });

        paymentService.placeOnlineOrder(USER_ID, khaltiOrder(2));

        verify(paymentGateway).initiate(any(), any());
    }

    @Test
    @DisplayName("결제 개시 시간 초과 - 주문은 결제 개시 실패로 취소, 재고 원복, 예외 전파")
    void testPlaceOnlineOrder_Timeout() {
        when(paymentGateway.initiate(any(), any()))
                .thenThrow(new PaymentGatewayTimeoutException("initiate", new SocketTimeoutException("Read timed out")));

        assertThrows(PaymentGatewayTimeoutException.class,
                () -> paymentService.placeOnlineOrder(USER_ID, khaltiOrder(2)));

        assertEquals(3, context.stock(mugId));
        List<OrderResponse> orders = context.orderService.getOrders(USER_ID);
        assertEquals(1, orders.size());
        assertEquals(OrderStatus.CANCELLED, orders.get(0).getOrderStatus());
        assertEquals(OrderConstants.REASON_PAYMENT_INITIATION_FAILED, orders.get(0).getCancellationReason());
        verify(paymentGateway, times(1)).initiate(any(), any());
    }

    @Test
    @DisplayName("연락처 누락 - 게이트웨이 호출 전에 거절")
    void testPlaceOnlineOrder_MissingContact() {
        CreateOrderCommand command = CreateOrderCommand.builder()
                .customer(TestDataFactory.customerWithoutEmail())
                .lines(List.of(line(mugId, 1)))
                .paymentMethod(PaymentMethod.KHALTI)
                .build();

        assertThrows(InvalidArgumentException.class, () -> paymentService.placeOnlineOrder(USER_ID, command));
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("온라인 결제 수단이 아니면 거절")
    void testPlaceOnlineOrder_OfflineMethod() {
        CreateOrderCommand command = TestDataFactory.order(PaymentMethod.CASH_ON_DELIVERY, line(mugId, 1));

        assertThrows(InvalidArgumentException.class, () -> paymentService.placeOnlineOrder(USER_ID, command));
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("장바구니 온라인 결제 - 결제 개시 실패 시 장바구니 유지")
    void testCheckoutCartOnline_RejectedKeepsCart() {
        context.cartService.addLine(USER_ID, new AddCartLineCommand(mugId, null, 2));
        when(paymentGateway.initiate(any(), any()))
                .thenThrow(new PaymentGatewayRejectedException("initiate", 401, "{\"detail\":\"Invalid token.\"}"));

        assertThrows(PaymentGatewayRejectedException.class, () -> paymentService.checkoutCartOnline(USER_ID,
                CheckoutCommand.builder().customer(TestDataFactory.customer()).build()));

        assertEquals(1, context.cartService.getLines(USER_ID).size());
        assertEquals(3, context.stock(mugId));
        assertEquals(OrderStatus.CANCELLED, context.orderService.getOrders(USER_ID).get(0).getOrderStatus());
    }

    @Test
    @DisplayName("장바구니 온라인 결제 - 결제 개시 성공 후 장바구니 비움")
    void testCheckoutCartOnline_ClearsCart() {
        context.cartService.addLine(USER_ID, new AddCartLineCommand(mugId, null, 2));
        when(paymentGateway.initiate(any(), any())).thenReturn(initiation());

        OnlineCheckoutResponse response = paymentService.checkoutCartOnline(USER_ID,
                CheckoutCommand.builder().customer(TestDataFactory.customer()).build());

        assertEquals(PIDX, response.getTransactionRef());
        assertTrue(context.cartService.getLines(USER_ID).isEmpty());
        assertEquals(1, context.stock(mugId));
    }

    @Test
    @DisplayName("검증 - Completed + 금액 일치 → 결제 확인 + PROCESSING")
    void testVerifyPayment_Completed() {
        Long orderId = placeOrder(2);
        when(paymentGateway.lookup(eq(PIDX), any())).thenReturn(lookup("Completed", 1100L));

        PaymentVerificationResult result = paymentService.verifyPayment(orderId, PIDX);

        assertEquals(Outcome.VERIFIED, result.getOutcome());
        assertTrue(result.isPaymentConfirmed());
        assertEquals(OrderStatus.PROCESSING, result.getOrderStatus());
        assertEquals(1, context.stock(mugId));
    }

    @Test
    @DisplayName("검증 - 이미 확인된 주문은 게이트웨이를 다시 호출하지 않는다")
    void testVerifyPayment_AlreadyVerified() {
        Long orderId = placeOrder(1);
        when(paymentGateway.lookup(eq(PIDX), any())).thenReturn(lookup("Completed", 550L));
        paymentService.verifyPayment(orderId, PIDX);

        PaymentVerificationResult second = paymentService.verifyPayment(orderId, PIDX);

        assertEquals(Outcome.ALREADY_VERIFIED, second.getOutcome());
        verify(paymentGateway, times(1)).lookup(eq(PIDX), any());
    }

    @Test
    @DisplayName("검증 - 금액 불일치 → 취소 + 재고 반환")
    void testVerifyPayment_AmountMismatch() {
        Long orderId = placeOrder(2);
        when(paymentGateway.lookup(eq(PIDX), any())).thenReturn(lookup("Completed", 100L));

        PaymentVerificationResult result = paymentService.verifyPayment(orderId, PIDX);

        assertEquals(Outcome.CANCELLED, result.getOutcome());
        assertFalse(result.isPaymentConfirmed());
        assertTrue(result.getReason().contains("결제 금액 불일치"));
        assertEquals(3, context.stock(mugId));
    }

    @Test
    @DisplayName("검증 - User canceled → 취소, 재고는 한 번만 반환")
    void testVerifyPayment_UserCanceled() {
        Long orderId = placeOrder(2);
        when(paymentGateway.lookup(eq(PIDX), any())).thenReturn(lookup("User canceled", 0L));

        PaymentVerificationResult first = paymentService.verifyPayment(orderId, PIDX);
        PaymentVerificationResult second = paymentService.verifyPayment(orderId, PIDX);

        assertEquals(Outcome.CANCELLED, first.getOutcome());
        assertEquals(PaymentGatewayStatus.USER_CANCELED, first.getGatewayStatus());
        assertEquals(Outcome.CANCELLED, second.getOutcome());
        assertEquals(3, context.stock(mugId));
        verify(paymentGateway, times(1)).lookup(eq(PIDX), any());
    }

    @Test
    @DisplayName("검증 - Pending → 주문 유지")
    void testVerifyPayment_Pending() {
        Long orderId = placeOrder(1);
        when(paymentGateway.lookup(eq(PIDX), any())).thenReturn(lookup("Pending", 0L));

        PaymentVerificationResult result = paymentService.verifyPayment(orderId, PIDX);

        assertEquals(Outcome.PENDING, result.getOutcome());
        assertEquals(OrderStatus.PENDING, result.getOrderStatus());
        assertEquals(2, context.stock(mugId));
    }

    @Test
    @DisplayName("검증 - 조회 시간 초과 → 예외 전파, 주문 유지")
    void testVerifyPayment_Timeout() {
        Long orderId = placeOrder(1);
        when(paymentGateway.lookup(eq(PIDX), any()))
                .thenThrow(new PaymentGatewayTimeoutException("lookup", new SocketTimeoutException("Read timed out")));

        assertThrows(PaymentGatewayTimeoutException.class, () -> paymentService.verifyPayment(orderId, PIDX));

        assertEquals(OrderStatus.PENDING, context.orderService.getOrder(orderId).getOrderStatus());
        assertEquals(2, context.stock(mugId));
    }

    @Test
    @DisplayName("검증 - 거래 식별자가 주문과 다르면 거절")
    void testVerifyPayment_ReferenceMismatch() {
        Long orderId = placeOrder(1);

        assertThrows(InvalidArgumentException.class, () -> paymentService.verifyPayment(orderId, "other-pidx"));
        assertThrows(InvalidArgumentException.class, () -> paymentService.verifyPayment(orderId, " "));
        verify(paymentGateway, never()).lookup(any(), any());
    }

    @Test
    @DisplayName("[회귀] 착불 주문은 임의의 거래 식별자로 검증할 수 없다")
    void testVerifyPayment_CashOnDeliveryRejected() {
        Long orderId = context.orderService.createOrder(USER_ID, TestDataFactory.codOrder(line(mugId, 1))).getOrderId();

        assertThrows(InvalidOrderStateException.class,
                () -> paymentService.verifyPayment(orderId, "pidx-of-another-order"));

        verify(paymentGateway, never()).lookup(any(), any());
        OrderResponse order = context.orderService.getOrder(orderId);
        assertFalse(order.isPaymentConfirmed());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertEquals(2, context.stock(mugId));
    }

    @Test
    @DisplayName("[회귀] 결제가 개시되지 않은 온라인 주문은 조회 전에 거절")
    void testVerifyPayment_NoReferenceRejected() {
        Long orderId = context.orderService.createOrder(USER_ID, khaltiOrder(1)).getOrderId();

        assertThrows(InvalidOrderStateException.class,
                () -> paymentService.verifyPayment(orderId, "pidx-of-another-order"));

        verify(paymentGateway, never()).lookup(any(), any());
        assertFalse(context.orderService.getOrder(orderId).isPaymentConfirmed());
    }

    private Long placeOrder(int quantity) {
        when(paymentGateway.initiate(any(), any())).thenReturn(initiation());
        return paymentService.placeOnlineOrder(USER_ID, khaltiOrder(quantity)).getOrder().getOrderId();
    }

    private CreateOrderCommand khaltiOrder(int quantity) {
        return TestDataFactory.order(PaymentMethod.KHALTI, line(mugId, quantity));
    }

    private static PaymentInitiation initiation() {
        return PaymentInitiation.builder()
                .paymentUrl("https://test-pay.khalti.com/?pidx=" + PIDX)
                .transactionRef(PIDX)
                .build();
    }

    private static PaymentLookup lookup(String status, long amountMinor) {
        return PaymentLookup.builder()
                .transactionRef(PIDX)
                .status(PaymentGatewayStatus.fromGatewayValue(status))
                .amountMinor(amountMinor)
                .build();
    }
}
