package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.inventory.InventoryService;
import com.hhplus.storefront.application.order.dto.CreateOrderCommand;
import com.hhplus.storefront.application.order.dto.OrderLineCommand;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.InvalidArgumentException;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.domain.order.Actor;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderConstants;
import com.hhplus.storefront.domain.order.OrderLine;
import com.hhplus.storefront.domain.order.OrderRepository;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.domain.order.OrderStatusEvent;
import com.hhplus.storefront.domain.order.OrderStatusEventRepository;
import com.hhplus.storefront.domain.order.event.OrderStatusChangedEvent;
import com.hhplus.storefront.domain.product.InsufficientStockException;
import com.hhplus.storefront.domain.product.Product;
import com.hhplus.storefront.domain.product.ProductNotFoundException;
import com.hhplus.storefront.domain.product.ProductRepository;
import com.hhplus.storefront.domain.product.ProductSizeNotFoundException;
import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * OrderTransactionService - 주문 생성 트랜잭션 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리된 독립적인 서비스
 * - 재고 예약, 스냅샷 생성, 주문 저장, 최초 이력 기록을 하나의 트랜잭션으로 처리
 * - @Transactional, @Retryable이 프록시를 통해 정상 작동하도록 보장
 *
 * 처리 순서:
 * 1. 주문 항목 검증 + 스냅샷 생성 (상품명, 사이즈명, 현재 단가)
 * 2. (productId, sizeId) 오름차순으로 재고 예약
 *    - 모든 트랜잭션이 같은 순서로 행 락을 잡으므로 교착 가능성이 줄어든다
 *    - 중간 실패 시 앞서 예약한 항목을 즉시 반환 (보상)
 * 3. 주문 저장
 * 4. PENDING 이력 기록 + 상태 변경 이벤트 발행
 *
 * 외부 결제 게이트웨이 호출은 이 트랜잭션에 포함하지 않는다. (PaymentService가 커밋 이후 수행)
 *
 * 동시성 제어:
 * - 재고 차감은 조건부 UPDATE 한 문장 (InventoryService.reserve)
 * - 교착/락 타임아웃(TransientDataAccessException)은 @Retryable로 재시도
 *   - maxAttempts=3, delay=50ms, multiplier=2, maxDelay=1000ms, random=true (Jitter)
 * - 재시도 소진 시 @Recover에서 LOCK_ACQUISITION_FAILED로 변환
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final OrderStatusEventRepository orderStatusEventRepository;
    private final ProductRepository productRepository;
    private final SizeRepository sizeRepository;
    private final InventoryService inventoryService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public OrderTransactionService(OrderRepository orderRepository,
                                   OrderStatusEventRepository orderStatusEventRepository,
                                   ProductRepository productRepository,
                                   SizeRepository sizeRepository,
                                   InventoryService inventoryService,
                                   ApplicationEventPublisher eventPublisher,
                                   Clock clock) {
        this.orderRepository = orderRepository;
        this.orderStatusEventRepository = orderStatusEventRepository;
        this.productRepository = productRepository;
        this.sizeRepository = sizeRepository;
        this.inventoryService = inventoryService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 주문 생성 트랜잭션
     *
     * @throws InsufficientStockException 재고 부족. 몇 번째 항목인지 포함하며 재고/주문 모두 변화 없음
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class
    )
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public Order executeTransactionalOrder(Long userId, CreateOrderCommand command) {
        if (command.getCustomer() == null) {
            throw new InvalidArgumentException(OrderConstants.MSG_CUSTOMER_INFO_REQUIRED);
        }
        List<OrderLineCommand> lineCommands = command.getLines();
        if (lineCommands == null || lineCommands.isEmpty()) {
            throw new InvalidArgumentException(OrderConstants.MSG_EMPTY_ORDER_LINES);
        }

        // 1. 스냅샷 생성 (상태 변경 없음)
        List<OrderLine> lines = new ArrayList<>(lineCommands.size());
        for (OrderLineCommand lineCommand : lineCommands) {
            lines.add(snapshotLine(lineCommand));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = Order.create(userId, command.getCustomer().toCustomerInfo(), command.getPaymentMethod(),
                command.getOrderNotes(), lines, now);

        // 2. 재고 예약 (정렬 순서)
        reserveAll(lines);

        // 3. 저장
        Order saved = orderRepository.save(order);

        // 4. 최초 이력 + 이벤트
        orderStatusEventRepository.append(OrderStatusEvent.of(saved.getOrderId(), OrderStatus.PENDING,
                Actor.customer(userId), OrderConstants.NOTE_ORDER_PLACED, now));
        eventPublisher.publishEvent(new OrderStatusChangedEvent(saved.getOrderId(), userId,
                null, OrderStatus.PENDING, OrderConstants.NOTE_ORDER_PLACED));

        log.info("[OrderTransactionService] 주문 생성 완료: orderId={}, userId={}, lines={}, totalAmount={}",
                saved.getOrderId(), userId, saved.getOrderLines().size(), saved.getTotalAmount());
        return saved;
    }

    /**
     * 재시도 소진 시 복구 처리
     */
    @Recover
    public Order recoverFromLockFailure(TransientDataAccessException e, Long userId,
                                        CreateOrderCommand command) {
        log.error("[OrderTransactionService] 재고 락 재시도 소진: userId={}, reason={}", userId, e.getMessage());
        throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "userId=" + userId, e);
    }

    private OrderLine snapshotLine(OrderLineCommand lineCommand) {
        if (lineCommand.getProductId() == null) {
            throw new InvalidArgumentException("상품 ID는 필수입니다");
        }
        Product product = productRepository.findById(lineCommand.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(lineCommand.getProductId()));

        String sizeName = null;
        if (lineCommand.getSizeId() != null) {
            sizeName = sizeRepository.findById(lineCommand.getSizeId())
                    .map(Size::getName)
                    .orElseThrow(() -> new ProductSizeNotFoundException(product.getProductId(), lineCommand.getSizeId()));
        }

        return OrderLine.createLine(product.getProductId(), product.getProductName(),
                lineCommand.getSizeId(), sizeName, product.getPrice(), lineCommand.getQuantity());
    }

    /**
     * (productId, sizeId) 오름차순 예약
     * 실패하면 이미 예약한 항목을 반환하고, 원래 주문 항목 순번을 붙여 예외를 던진다.
     */
    private void reserveAll(List<OrderLine> lines) {
        List<Integer> reserveOrder = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            reserveOrder.add(i);
        }
        reserveOrder.sort(Comparator
                .comparing((Integer i) -> lines.get(i).getProductId())
                .thenComparing(i -> lines.get(i).getSizeId(), Comparator.nullsFirst(Comparator.naturalOrder())));

        List<OrderLine> reserved = new ArrayList<>();
        for (Integer index : reserveOrder) {
            OrderLine line = lines.get(index);
            try {
                inventoryService.reserve(line.getProductId(), line.getSizeId(), line.getQuantity());
                reserved.add(line);
            } catch (InsufficientStockException e) {
                releaseAll(reserved);
                throw e.forLine(index, line.getProductName());
            } catch (RuntimeException e) {
                releaseAll(reserved);
                throw e;
            }
        }
    }

    private void releaseAll(List<OrderLine> reserved) {
        for (OrderLine line : reserved) {
            inventoryService.release(line.getProductId(), line.getSizeId(), line.getQuantity());
        }
        if (!reserved.isEmpty()) {
            log.info("[OrderTransactionService] 예약 보상 완료: releasedLines={}", reserved.size());
        }
    }
}
