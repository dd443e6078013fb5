package com.hhplus.storefront.infrastructure.payment.khalti;

import com.hhplus.storefront.application.payment.PaymentGateway;
import com.hhplus.storefront.application.payment.PaymentGatewayRejectedException;
import com.hhplus.storefront.application.payment.PaymentGatewayTimeoutException;
import com.hhplus.storefront.application.payment.dto.PaymentGatewayStatus;
import com.hhplus.storefront.application.payment.dto.PaymentInitiation;
import com.hhplus.storefront.application.payment.dto.PaymentInitiationRequest;
import com.hhplus.storefront.application.payment.dto.PaymentLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * KhaltiPaymentGateway - Khalti Web Checkout (KPG-2) 연동
 *
 * - POST {base}/epayment/initiate/ : 결제 개시, pidx + payment_url 반환
 * - POST {base}/epayment/lookup/   : pidx로 결제 상태 조회
 * - 인증 헤더: Authorization: Key {secret}
 *
 * 오류 변환:
 * - 소켓 타임아웃 → PaymentGatewayTimeoutException
 * - 4XX/5XX 응답, 그 외 통신 오류 → PaymentGatewayRejectedException
 *
 * RestTemplate은 타임아웃 값별로 하나씩 만들어 재사용한다.
 */
@Component
public class KhaltiPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(KhaltiPaymentGateway.class);

    static final String INITIATE_PATH = "/epayment/initiate/";
    static final String LOOKUP_PATH = "/epayment/lookup/";

    private final RestTemplateBuilder restTemplateBuilder;
    private final Map<Duration, RestTemplate> restTemplates = new ConcurrentHashMap<>();
    private final String baseUrl;
    private final String secretKey;
    private final String returnUrl;
    private final String websiteUrl;

    public KhaltiPaymentGateway(RestTemplateBuilder restTemplateBuilder,
                                @Value("${payment.khalti.base-url:https://dev.khalti.com/api/v2}") String baseUrl,
                                @Value("${payment.khalti.secret-key:}") String secretKey,
                                @Value("${payment.khalti.return-url:http://localhost:8080/api/payments/khalti/callback}") String returnUrl,
                                @Value("${payment.khalti.website-url:http://localhost:8080/}") String websiteUrl,
                                @Value("${payment.khalti.timeout-seconds:30}") long defaultTimeoutSeconds) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.secretKey = secretKey;
        this.returnUrl = returnUrl;
        this.websiteUrl = websiteUrl;
        if (secretKey == null || secretKey.isBlank()) {
            log.warn("[KhaltiPaymentGateway] payment.khalti.secret-key가 설정되지 않았습니다");
        }
        // 기본 타임아웃용 RestTemplate은 미리 만들어 둔다
        restTemplateFor(Duration.ofSeconds(defaultTimeoutSeconds));
    }

    @Override
    public PaymentInitiation initiate(PaymentInitiationRequest request, Duration timeout) {
        KhaltiInitiateRequest body = toKhaltiRequest(request);
        KhaltiInitiateResponse response = post(INITIATE_PATH, body, KhaltiInitiateResponse.class, timeout, "initiate");

        if (response == null || response.getPidx() == null || response.getPaymentUrl() == null) {
            throw new PaymentGatewayRejectedException("initiate", 200, "pidx 또는 payment_url 누락");
        }
        log.info("[KhaltiPaymentGateway] 결제 개시 성공: purchaseOrderId={}, pidx={}",
                request.getPurchaseOrderId(), response.getPidx());
        return PaymentInitiation.builder()
                .paymentUrl(response.getPaymentUrl())
                .transactionRef(response.getPidx())
                .build();
    }

    @Override
    public PaymentLookup lookup(String transactionRef, Duration timeout) {
        KhaltiLookupResponse response = post(LOOKUP_PATH, new KhaltiLookupRequest(transactionRef),
                KhaltiLookupResponse.class, timeout, "lookup");

        if (response == null || response.getStatus() == null) {
            throw new PaymentGatewayRejectedException("lookup", 200, "status 누락");
        }
        log.info("[KhaltiPaymentGateway] 결제 조회: pidx={}, status={}, totalAmount={}",
                transactionRef, response.getStatus(), response.getTotalAmount());
        return PaymentLookup.builder()
                .transactionRef(response.getPidx() != null ? response.getPidx() : transactionRef)
                .status(PaymentGatewayStatus.fromGatewayValue(response.getStatus()))
                .amountMinor(response.getTotalAmount() == null ? 0L : response.getTotalAmount())
                .gatewayTransactionId(response.getTransactionId())
                .build();
    }

    private <T> T post(String path, Object body, Class<T> responseType, Duration timeout, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, "Key " + secretKey);

        try {
            return restTemplateFor(timeout).postForObject(baseUrl + path, new HttpEntity<>(body, headers), responseType);
        } catch (HttpStatusCodeException e) {
            log.error("[KhaltiPaymentGateway] {} 실패: status={}, body={}",
                    operation, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new PaymentGatewayRejectedException(operation, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.warn("[KhaltiPaymentGateway] {} 시간 초과: timeout={}", operation, timeout);
                throw new PaymentGatewayTimeoutException(operation, e);
            }
            log.error("[KhaltiPaymentGateway] {} 통신 오류: {}", operation, e.getMessage());
            throw new PaymentGatewayRejectedException(operation, e);
        } catch (RestClientException e) {
            log.error("[KhaltiPaymentGateway] {} 응답 처리 오류: {}", operation, e.getMessage());
            throw new PaymentGatewayRejectedException(operation, e);
        }
    }

    private RestTemplate restTemplateFor(Duration timeout) {
        return restTemplates.computeIfAbsent(timeout, t -> restTemplateBuilder
                .setConnectTimeout(t)
                .setReadTimeout(t)
                .build());
    }

    private KhaltiInitiateRequest toKhaltiRequest(PaymentInitiationRequest request) {
        List<KhaltiInitiateRequest.ProductDetail> products = request.getLineItems().stream()
                .map(item -> KhaltiInitiateRequest.ProductDetail.builder()
                        .identity(item.getIdentity())
                        .name(item.getName())
                        .totalPrice(item.getTotalPriceMinor())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPriceMinor())
                        .build())
                .collect(Collectors.toList());

        return KhaltiInitiateRequest.builder()
                .returnUrl(returnUrl)
                .websiteUrl(websiteUrl)
                .amount(request.getAmountMinor())
                .purchaseOrderId(request.getPurchaseOrderId())
                .purchaseOrderName(request.getPurchaseOrderName())
                .customerInfo(KhaltiInitiateRequest.CustomerInfo.builder()
                        .name(request.getCustomerName())
                        .email(request.getCustomerEmail())
                        .phone(request.getCustomerPhone())
                        .build())
                .amountBreakdown(List.of(KhaltiInitiateRequest.AmountBreakdown.builder()
                        .label("Total Amount")
                        .amount(request.getAmountMinor())
                        .build()))
                .productDetails(products)
                .build();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
