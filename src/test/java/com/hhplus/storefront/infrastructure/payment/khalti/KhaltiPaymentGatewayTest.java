package com.hhplus.storefront.infrastructure.payment.khalti;

import com.hhplus.storefront.application.payment.PaymentGatewayRejectedException;
import com.hhplus.storefront.application.payment.PaymentGatewayTimeoutException;
import com.hhplus.storefront.application.payment.dto.PaymentGatewayStatus;
import com.hhplus.storefront.application.payment.dto.PaymentInitiation;
import com.hhplus.storefront.application.payment.dto.PaymentInitiationRequest;
import com.hhplus.storefront.application.payment.dto.PaymentLookup;
import com.hhplus.storefront.domain.order.CustomerInfo;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderLine;
import com.hhplus.storefront.domain.order.PaymentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * KhaltiPaymentGatewayTest - Khalti API 연동 단위 테스트
 *
 * MockRestServiceServer로 HTTP 요청/응답을 검증한다.
 */
@DisplayName("KhaltiPaymentGateway 단위 테스트")
class KhaltiPaymentGatewayTest {

    private static final String BASE_URL = "https://khalti.test/api/v2/";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockRestServiceServer server;
    private KhaltiPaymentGateway gateway;

    @BeforeEach
    void setup() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        gateway = new KhaltiPaymentGateway(new RestTemplateBuilder(customizer), BASE_URL, "test-secret",
                "http://localhost:8080/api/payments/khalti/callback", "http://localhost:8080/", TIMEOUT.getSeconds());
        server = customizer.getServer();
    }

    @Test
    @DisplayName("결제 개시 - 최소 단위 금액, 인증 헤더, 상품 상세 전송")
    void testInitiate() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/initiate/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Key test-secret"))
                .andExpect(jsonPath("$.amount").value(4548))
                .andExpect(jsonPath("$.purchase_order_id").value("42"))
                .andExpect(jsonPath("$.purchase_order_name").value("Order #42"))
                .andExpect(jsonPath("$.customer_info.email").value("hana@example.com"))
                .andExpect(jsonPath("$.product_details[0].name").value("티셔츠 (M)"))
                .andExpect(jsonPath("$.product_details[0].total_price").value(3998))
                .andExpect(jsonPath("$.product_details[1].identity").value("deleted"))
                .andRespond(withSuccess("{\"pidx\":\"HT6o6PEZRWFJ5ygavzHWd5\","
                        + "\"payment_url\":\"https://test-pay.khalti.com/?pidx=HT6o6PEZRWFJ5ygavzHWd5\","
                        + "\"expires_at\":\"2026-03-02T11:30:00+05:45\",\"expires_in\":1800}",
                        MediaType.APPLICATION_JSON));

        PaymentInitiation initiation = gateway.initiate(request(), TIMEOUT);

        assertEquals("HT6o6PEZRWFJ5ygavzHWd5", initiation.getTransactionRef());
        assertEquals("https://test-pay.khalti.com/?pidx=HT6o6PEZRWFJ5ygavzHWd5", initiation.getPaymentUrl());
        server.verify();
    }

    @Test
    @DisplayName("결제 개시 - 4XX 응답은 거절 예외 (원격 상태 포함)")
    void testInitiate_Rejected() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/initiate/"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":\"Invalid token.\",\"status_code\":401}"));

        PaymentGatewayRejectedException e = assertThrows(PaymentGatewayRejectedException.class,
                () -> gateway.initiate(request(), TIMEOUT));

        assertEquals(401, e.getRemoteStatus());
    }

    @Test
    @DisplayName("결제 개시 - pidx 누락 응답은 거절")
    void testInitiate_MissingPidx() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/initiate/"))
                .andRespond(withSuccess("{\"payment_url\":\"https://test-pay.khalti.com/\"}", MediaType.APPLICATION_JSON));

        assertThrows(PaymentGatewayRejectedException.class, () -> gateway.initiate(request(), TIMEOUT));
    }

    @Test
    @DisplayName("결제 조회 - 상태와 금액 변환")
    void testLookup() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/lookup/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.pidx").value("HT6o6PEZRWFJ5ygavzHWd5"))
                .andRespond(withSuccess("{\"pidx\":\"HT6o6PEZRWFJ5ygavzHWd5\",\"total_amount\":4548,"
                        + "\"status\":\"Completed\",\"transaction_id\":\"GFq9PFS7b2iYvL8Lir9oXe\","
                        + "\"fee\":0,\"refunded\":false}", MediaType.APPLICATION_JSON));

        PaymentLookup lookup = gateway.lookup("HT6o6PEZRWFJ5ygavzHWd5", TIMEOUT);

        assertEquals(PaymentGatewayStatus.COMPLETED, lookup.getStatus());
        assertEquals(4548L, lookup.getAmountMinor());
        assertEquals("GFq9PFS7b2iYvL8Lir9oXe", lookup.getGatewayTransactionId());
    }

    @Test
    @DisplayName("결제 조회 - 알 수 없는 상태는 UNKNOWN")
    void testLookup_UnknownStatus() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/lookup/"))
                .andRespond(withSuccess("{\"pidx\":\"abc\",\"total_amount\":100,\"status\":\"On hold\"}",
                        MediaType.APPLICATION_JSON));

        PaymentLookup lookup = gateway.lookup("abc", TIMEOUT);

        assertEquals(PaymentGatewayStatus.UNKNOWN, lookup.getStatus());
        assertFalse(lookup.getStatus().isFailure());
    }

    @Test
    @DisplayName("결제 조회 - 소켓 타임아웃은 시간 초과 예외")
    void testLookup_Timeout() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/lookup/"))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThrows(PaymentGatewayTimeoutException.class, () -> gateway.lookup("abc", TIMEOUT));
    }

    @Test
    @DisplayName("결제 조회 - 5XX 응답은 거절")
    void testLookup_ServerError() {
        server.expect(requestTo("https://khalti.test/api/v2/epayment/lookup/"))
                .andRespond(withServerError());

        PaymentGatewayRejectedException e = assertThrows(PaymentGatewayRejectedException.class,
                () -> gateway.lookup("abc", TIMEOUT));
        assertEquals(500, e.getRemoteStatus());
    }

    private static PaymentInitiationRequest request() {
        CustomerInfo customer = CustomerInfo.builder()
                .fullName("김하나")
                .email("hana@example.com")
                .phone("9800000001")
                .address("Lazimpat")
                .city("Kathmandu")
                .build();
        OrderLine shirt = OrderLine.createLine(10L, "티셔츠", 1L, "M", new BigDecimal("19.99"), 2);
        OrderLine deleted = OrderLine.createLine(20L, "머그컵", null, null, new BigDecimal("5.50"), 1);
        deleted.detachProduct();

        Order order = Order.create(7L, customer, PaymentMethod.KHALTI, null, List.of(shirt, deleted),
                LocalDateTime.of(2026, 3, 2, 10, 0));
        return PaymentInitiationRequest.forOrder(order.toBuilder().orderId(42L).build());
    }
}
