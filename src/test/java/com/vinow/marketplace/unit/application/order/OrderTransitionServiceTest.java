package com.vinow.marketplace.unit.application.order;

import com.vinow.marketplace.application.order.OrderTransactionService;
import com.vinow.marketplace.application.order.OrderTransitionService;
import com.vinow.marketplace.common.exception.ConcurrencyConflictException;
import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.config.InMemoryMarketplaceFixture;
import com.vinow.marketplace.domain.order.InvalidOrderStatusException;
import com.vinow.marketplace.domain.order.InvalidOrderTransitionException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import com.vinow.marketplace.infrastructure.lock.LockKeyGenerator;
import com.vinow.marketplace.infrastructure.lock.OrderLockManager;
import com.vinow.marketplace.unit.BaseUnitTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("OrderTransitionService 테스트")
class OrderTransitionServiceTest extends BaseUnitTest {

    @Mock
    private OrderLockManager orderLockManager;

    @Mock
    private OrderTransactionService orderTransactionService;

    @InjectMocks
    private OrderTransitionService orderTransitionService;

    // ========== 요청 검증 (Mock) ==========

    @Test
    @DisplayName("목표 상태 누락 - 락 획득 전 ValidationException")
    void testTransition_MissingTarget() {
        assertThrows(ValidationException.class,
                () -> orderTransitionService.transition(1L, null, "merchant", null));
        verifyNoInteractions(orderLockManager, orderTransactionService);
    }

    @Test
    @DisplayName("락 경합 패배 - ConcurrencyConflictException 전파, 트랜잭션 미실행")
    void testTransition_LockConflict() {
        // Given
        when(orderLockManager.executeWithLock(eq(LockKeyGenerator.order(1L)), any()))
                .thenThrow(new ConcurrencyConflictException("busy"));

        // When & Then
        assertThrows(ConcurrencyConflictException.class,
                () -> orderTransitionService.transition(1L, OrderStatus.CONFIRMED, "merchant", null));
        verifyNoInteractions(orderTransactionService);
    }

    // ========== 메모리 저장소 연동 ==========

    @Nested
    @DisplayName("메모리 저장소 연동")
    class WithInMemoryStore {

        private final InMemoryMarketplaceFixture fixture =
                new InMemoryMarketplaceFixture(LocalDateTime.of(2025, 1, 15, 10, 0));

        @Test
        @DisplayName("CONFIRMED 전환 - 저장 및 상태 변경 이벤트 발행")
        void testTransition_ConfirmPublishesEvent() {
            // Given
            Order order = fixture.saveOrder("TRNS0001", 40000L);

            // When
            Order confirmed = fixture.orderTransitionService.transition(order.getOrderId(), OrderStatus.CONFIRMED,
                    "merchant:10", null);

            // Then
            assertEquals(OrderStatus.CONFIRMED, confirmed.getOrderStatus());
            assertEquals(1, fixture.publishedEvents.size());
            OrderStatusChangedEvent event = (OrderStatusChangedEvent) fixture.publishedEvents.get(0);
            assertEquals(OrderStatus.PENDING, event.getFromStatus());
            assertEquals(OrderStatus.CONFIRMED, event.getToStatus());
            assertEquals("merchant:10", event.getActor());
        }

        @Test
        @DisplayName("허용되지 않는 전환 - 예외, 이벤트 없음, 상태 유지")
        void testTransition_InvalidEdge() {
            // Given
            Order order = fixture.saveOrder("TRNS0002", 40000L);

            // When & Then
            assertThrows(InvalidOrderTransitionException.class, () -> fixture.orderTransitionService
                    .transition(order.getOrderId(), OrderStatus.COMPLETED, "merchant:10", null));
            assertTrue(fixture.publishedEvents.isEmpty());
            assertEquals(OrderStatus.PENDING, fixture.orderRepository.findById(order.getOrderId())
                    .orElseThrow().getOrderStatus());
        }

        @Test
        @DisplayName("환불 처리 중 주문 - 일반 전환 불가")
        void testTransition_FromRefunding() {
            // Given
            Order order = fixture.saveOrder("TRNS0003", 40000L);
            fixture.refundService.requestRefund(order.getOrderId(), "주문 실수", null, null);

            // When
            InvalidOrderStatusException exception = assertThrows(InvalidOrderStatusException.class,
                    () -> fixture.orderTransitionService
                            .transition(order.getOrderId(), OrderStatus.PENDING, "merchant:10", "복원"));

            // Then
            assertEquals(OrderStatus.REFUNDING, exception.getCurrentStatus());
            assertTrue(exception.getMessage().contains("approveRefund/rejectRefund"));
            assertEquals(OrderStatus.REFUNDING, order.getOrderStatus());
        }

        @Test
        @DisplayName("전용 작업 대상(READY → VERIFIED) - InvalidOrderStatusException, 전용 작업 안내")
        void testTransition_DedicatedTarget() {
            // Given
            Order order = fixture.saveOrder("TRNS0004", 40000L);
            fixture.orderTransitionService.transition(order.getOrderId(), OrderStatus.CONFIRMED, "merchant:10", null);
            fixture.orderTransitionService.transition(order.getOrderId(), OrderStatus.PREPARING, "merchant:10", null);
            fixture.orderTransitionService.transition(order.getOrderId(), OrderStatus.READY, "merchant:10", null);
            fixture.publishedEvents.clear();

            // When
            InvalidOrderStatusException exception = assertThrows(InvalidOrderStatusException.class,
                    () -> fixture.orderTransitionService
                            .transition(order.getOrderId(), OrderStatus.VERIFIED, "merchant:10", null));

            // Then
            assertFalse(exception instanceof InvalidOrderTransitionException);
            assertTrue(exception.getMessage().contains("verifyByCode/verifyByQR"));
            assertEquals(OrderStatus.READY, order.getOrderStatus());
            assertTrue(fixture.publishedEvents.isEmpty());
        }

        @Test
        @DisplayName("동시 취소 요청 2건 - 1건만 성공, 나머지는 InvalidOrderStatusException")
        void testTransition_ConcurrentCancel() throws Exception {
            // Given
            Order order = fixture.saveOrder("TRNS0005", 40000L);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger successCount = new AtomicInteger();
            List<Exception> failures = new CopyOnWriteArrayList<>();

            // When
            List<Future<?>> futures = new ArrayList<>();
            for (String actor : List.of("user:100", "merchant:10")) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        fixture.orderTransitionService.transition(order.getOrderId(), OrderStatus.CANCELLED,
                                actor, "취소 요청 - " + actor);
                        successCount.incrementAndGet();
                    } catch (Exception e) {
                        failures.add(e);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Then
            assertEquals(1, successCount.get());
            assertEquals(1, failures.size());
            assertInstanceOf(InvalidOrderStatusException.class, failures.get(0));
            assertEquals(OrderStatus.CANCELLED, order.getOrderStatus());
            assertEquals(1, fixture.publishedEvents.size());
        }
    }
}
