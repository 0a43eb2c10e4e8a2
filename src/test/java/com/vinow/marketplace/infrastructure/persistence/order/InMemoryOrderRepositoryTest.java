package com.vinow.marketplace.infrastructure.persistence.order;

import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryOrderRepository 테스트")
class InMemoryOrderRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 14, 12, 0);

    private InMemoryOrderRepository orderRepository;

    @BeforeEach
    void setUp() {
        orderRepository = new InMemoryOrderRepository();
    }

    @Test
    @DisplayName("save - 주문 ID와 주문 항목 ID 자동 할당")
    void testSave_AssignsIds() {
        // When
        Order saved = orderRepository.save(TestDataFactory.order("MEM00001", 30000L, NOW));

        // Then
        assertNotNull(saved.getOrderId());
        assertNotNull(saved.getOrderItems().get(0).getOrderItemId());
    }

    @Test
    @DisplayName("save - 다른 주문이 같은 검증 코드를 쓰면 거부")
    void testSave_DuplicateVerificationCode() {
        // Given
        orderRepository.save(TestDataFactory.order("MEM00002", 30000L, NOW));

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> orderRepository.save(TestDataFactory.order("MEM00002", 10000L, NOW)));
    }

    @Test
    @DisplayName("save - 같은 주문 재저장은 허용")
    void testSave_SameOrderTwice() {
        Order saved = orderRepository.save(TestDataFactory.order("MEM00003", 30000L, NOW));

        assertDoesNotThrow(() -> orderRepository.save(saved));
        assertEquals(1, orderRepository.countByMerchantId(TestDataFactory.MERCHANT_ID, null));
    }

    @Test
    @DisplayName("findByVerificationCode - 코드로 조회, 없으면 empty")
    void testFindByVerificationCode() {
        Order saved = orderRepository.save(TestDataFactory.order("MEM00004", 30000L, NOW));

        Optional<Order> found = orderRepository.findByVerificationCode("MEM00004");

        assertTrue(found.isPresent());
        assertEquals(saved.getOrderId(), found.get().getOrderId());
        assertTrue(orderRepository.findByVerificationCode("NOPE0000").isEmpty());
        assertTrue(orderRepository.existsByVerificationCode("MEM00004"));
    }

    @Test
    @DisplayName("findByMerchantIdAndCreatedAtBetween - 반열린 구간 [from, to)")
    void testFindByCreatedAtBetween_HalfOpen() {
        // Given
        LocalDateTime from = LocalDateTime.of(2025, 1, 14, 0, 0);
        LocalDateTime to = from.plusDays(1);
        orderRepository.save(TestDataFactory.order("MEM00005", 1000L, from));
        orderRepository.save(TestDataFactory.order("MEM00006", 1000L, to.minusNanos(1)));
        orderRepository.save(TestDataFactory.order("MEM00007", 1000L, to));
        orderRepository.save(TestDataFactory.order(99L, "MEM00008", 1000L, from.plusHours(1)));

        // When
        List<Order> result = orderRepository.findByMerchantIdAndCreatedAtBetween(TestDataFactory.MERCHANT_ID, from, to);

        // Then
        assertEquals(2, result.size());
        assertEquals("MEM00005", result.get(0).getVerificationCode());
        assertEquals("MEM00006", result.get(1).getVerificationCode());
    }

    @Test
    @DisplayName("findByMerchantId - 상태 필터와 페이지")
    void testFindByMerchantId_StatusAndPaging() {
        // Given
        OrderTransitionPolicy policy = OrderTransitionPolicy.defaultPolicy();
        for (int i = 0; i < 5; i++) {
            orderRepository.save(TestDataFactory.order("PAGE000" + i, 1000L, NOW.plusMinutes(i)));
        }
        Order cancelled = orderRepository.findByVerificationCode("PAGE0000").orElseThrow();
        cancelled.transitionTo(OrderStatus.CANCELLED, policy, "user:100", "고객 요청", NOW.plusHours(1));

        // When
        List<Order> pending = orderRepository.findByMerchantId(TestDataFactory.MERCHANT_ID, OrderStatus.PENDING, 0, 3);
        List<Order> secondPage = orderRepository.findByMerchantId(TestDataFactory.MERCHANT_ID, null, 1, 3);

        // Then
        assertEquals(3, pending.size());
        assertEquals("PAGE0004", pending.get(0).getVerificationCode());
        assertEquals(2, secondPage.size());
        assertEquals(4, orderRepository.countByMerchantId(TestDataFactory.MERCHANT_ID, OrderStatus.PENDING));
    }

    @Test
    @DisplayName("findAllByIds - 없는 ID는 무시, 중복 제거")
    void testFindAllByIds() {
        Order first = orderRepository.save(TestDataFactory.order("MEM00009", 1000L, NOW));

        List<Order> result = orderRepository.findAllByIds(List.of(first.getOrderId(), first.getOrderId(), 123456L));

        assertEquals(1, result.size());
    }
}
