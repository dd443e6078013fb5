package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.inventory.InventoryService;
import com.hhplus.storefront.application.order.dto.BuyNowCommand;
import com.hhplus.storefront.application.order.dto.OrderResponse;
import com.hhplus.storefront.application.order.dto.OrderStatusEventResponse;
import com.hhplus.storefront.application.product.ProductCatalogService;
import com.hhplus.storefront.application.product.dto.RegisterProductCommand;
import com.hhplus.storefront.common.exception.BizException;
import com.hhplus.storefront.config.MySQLIntegrationTestSupport;
import com.hhplus.storefront.config.TestDataFactory;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.PaymentMethod;
import com.hhplus.storefront.domain.product.InsufficientStockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 주문/재고 MySQL 통합 테스트
 *
 * - 마지막 재고에 대한 동시 주문: 1건만 성공, 재고는 음수가 되지 않음
 * - 취소 시 재고 1회 반환, 이력 기록
 */
@DisplayName("주문/재고 통합 테스트 (MySQL)")
class OrderInventoryIntegrationTest extends MySQLIntegrationTestSupport {

    @Autowired
    private OrderService orderService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private ProductCatalogService productCatalogService;

    @Test
    @DisplayName("마지막 재고 1개에 10명 동시 주문 - 1건 성공, 9건 재고 부족")
    void testLastUnit_ConcurrentBuyNow() throws InterruptedException {
        // Given
        Long productId = registerProduct("한정판 머그컵", "12.00", 1);
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            long userId = 100L + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    orderService.buyNow(userId, buyNow(productId, 1));
                    successCount.incrementAndGet();
                } catch (InsufficientStockException e) {
                    insufficientCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        assertEquals(1, successCount.get());
        assertEquals(threadCount - 1, insufficientCount.get());
        assertEquals(0, inventoryService.availableQuantity(productId, null));
    }

    @Test
    @DisplayName("고객 취소 - 재고 반환 후 두 번째 취소는 거절, 재고는 한 번만 반환")
    void testCancel_ReleasesStockOnce() {
        // Given
        Long productId = registerProduct("에코백", "8.50", 5);
        OrderResponse order = orderService.createOrder(1L,
                TestDataFactory.order(PaymentMethod.CASH_ON_DELIVERY, TestDataFactory.line(productId, 3)));
        assertEquals(2, inventoryService.availableQuantity(productId, null));

        // When
        OrderResponse cancelled = orderService.cancelOrder(order.getOrderId(), Actor.customer(1L), null, true);

        // Then
        assertEquals(OrderStatus.CANCELLED, cancelled.getOrderStatus());
        assertEquals(5, inventoryService.availableQuantity(productId, null));
        assertThrows(BizException.class,
                () -> orderService.cancelOrder(order.getOrderId(), Actor.customer(1L), null, true));
        assertEquals(5, inventoryService.availableQuantity(productId, null));

        List<OrderStatusEventResponse> history = orderService.getOrderHistory(order.getOrderId());
        assertEquals(2, history.size());
        assertEquals(OrderStatus.CANCELLED, history.get(history.size() - 1).getStatus());
    }

    @Test
    @DisplayName("부분 실패 - 두 번째 항목 재고 부족 시 첫 번째 항목 차감도 롤백")
    void testPartialFailure_RollsBack() {
        // Given
        Long first = registerProduct("볼펜", "1.20", 10);
        Long second = registerProduct("노트", "3.00", 1);

        // When
        assertThrows(InsufficientStockException.class, () -> orderService.createOrder(1L,
                TestDataFactory.codOrder(TestDataFactory.line(first, 4), TestDataFactory.line(second, 2))));

        // Then
        assertEquals(10, inventoryService.availableQuantity(first, null));
        assertEquals(1, inventoryService.availableQuantity(second, null));
    }

    private Long registerProduct(String name, String price, int stock) {
        return productCatalogService.registerProduct(RegisterProductCommand.builder()
                .productName(name)
                .price(new BigDecimal(price))
                .initialStock(stock)
                .build()).getProductId();
    }

    private static BuyNowCommand buyNow(Long productId, int quantity) {
        return BuyNowCommand.builder()
                .productId(productId)
                .quantity(quantity)
                .customer(TestDataFactory.customer())
                .paymentMethod(PaymentMethod.CASH_ON_DELIVERY)
                .build();
    }
}
