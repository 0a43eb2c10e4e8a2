package com.vinow.marketplace.unit.domain.order;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.order.InvalidOrderStatusException;
import com.vinow.marketplace.domain.order.InvalidOrderTransitionException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderItem;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import com.vinow.marketplace.domain.order.PaymentMethod;
import com.vinow.marketplace.domain.order.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 단위 테스트
 *
 * - 생성 규칙 (금액 계산, 항목 검증)
 * - 상태 전환 부수 효과
 * - 환불 요청/승인/거절
 * - 결제 상태 갱신
 */
@DisplayName("Order 도메인 단위 테스트")
class OrderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 15, 10, 0);

    private final OrderTransitionPolicy policy = OrderTransitionPolicy.defaultPolicy();

    // ========== 생성 ==========

    @Test
    @DisplayName("주문 생성 - 금액 계산 및 초기 상태")
    void testCreateOrder_Success() {
        // Given
        List<OrderItem> items = List.of(
                OrderItem.createOrderItem(1L, "쌀국수", 50000L, 2),
                OrderItem.createOrderItem(2L, "음료", 25000L, 1));

        // When
        Order order = Order.createOrder("ORD1", 10L, 20L, 100L, items, 5000L, PaymentMethod.MOMO,
                null, "CODE0001", NOW);

        // Then
        assertEquals(125000L, order.getTotalAmount());
        assertEquals(5000L, order.getDiscountAmount());
        assertEquals(120000L, order.getFinalAmount());
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertEquals(PaymentStatus.PENDING, order.getPaymentStatus());
        assertEquals(Order.DEFAULT_CURRENCY, order.getCurrency());
        assertEquals(2, order.getOrderItems().size());
    }

    @Test
    @DisplayName("주문 생성 - 할인액이 총액보다 크면 ValidationException")
    void testCreateOrder_NegativeFinalAmount() {
        List<OrderItem> items = List.of(OrderItem.createOrderItem(1L, "쌀국수", 10000L, 1));

        assertThrows(ValidationException.class, () -> Order.createOrder("ORD1", 10L, 20L, 100L, items,
                20000L, PaymentMethod.CASH, "VND", "CODE0001", NOW));
    }

    @Test
    @DisplayName("주문 생성 - 항목 없음 ValidationException")
    void testCreateOrder_NoItems() {
        assertThrows(ValidationException.class, () -> Order.createOrder("ORD1", 10L, 20L, 100L, List.of(),
                0L, PaymentMethod.CASH, "VND", "CODE0001", NOW));
    }

    @Test
    @DisplayName("주문 항목 - 수량 0 ValidationException")
    void testCreateOrderItem_ZeroQuantity() {
        assertThrows(ValidationException.class, () -> OrderItem.createOrderItem(1L, "쌀국수", 10000L, 0));
    }

    @Test
    @DisplayName("주문 항목 - 단가 × 수량 overflow ValidationException")
    void testCreateOrderItem_SubtotalOverflow() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> OrderItem.createOrderItem(1L, "쌀국수", Long.MAX_VALUE / 2, 3));

        assertInstanceOf(ArithmeticException.class, exception.getCause());
    }

    @Test
    @DisplayName("주문 생성 - 항목 합계 overflow ValidationException")
    void testCreateOrder_TotalOverflow() {
        List<OrderItem> items = List.of(
                OrderItem.createOrderItem(1L, "쌀국수", Long.MAX_VALUE - 1, 1),
                OrderItem.createOrderItem(2L, "반미", 10L, 1));

        assertThrows(ValidationException.class, () -> Order.createOrder("ORD1", 10L, 20L, 100L, items,
                0L, PaymentMethod.CASH, "VND", "CODE0001", NOW));
    }

    // ========== 상태 전환 ==========

    @Test
    @DisplayName("정상 흐름 - 각 단계 타임스탬프 기록")
    void testTransition_HappyPathTimestamps() {
        // Given
        Order order = TestDataFactory.order("FLOW0001", 30000L, NOW);

        // When
        order.transitionTo(OrderStatus.CONFIRMED, policy, "merchant", null, NOW.plusMinutes(1));
        order.transitionTo(OrderStatus.PREPARING, policy, "merchant", null, NOW.plusMinutes(2));
        order.transitionTo(OrderStatus.READY, policy, "merchant", null, NOW.plusMinutes(3));
        order.markVerified(policy, "staff-1", NOW.plusMinutes(4));
        order.transitionTo(OrderStatus.COMPLETED, policy, "system", null, NOW.plusMinutes(5));

        // Then
        assertEquals(OrderStatus.COMPLETED, order.getOrderStatus());
        assertEquals(NOW.plusMinutes(1), order.getConfirmedAt());
        assertEquals(NOW.plusMinutes(3), order.getReadyAt());
        assertEquals(NOW.plusMinutes(4), order.getVerifiedAt());
        assertEquals(NOW.plusMinutes(5), order.getCompletedAt());
        assertEquals("system", order.getStatusChangedBy());
    }

    @Test
    @DisplayName("허용되지 않는 전환 - 예외 후 상태 변경 없음")
    void testTransition_Rejected_StateUnchanged() {
        // Given
        Order order = TestDataFactory.order("REJ00001", 30000L, NOW);

        // When & Then
        assertThrows(InvalidOrderTransitionException.class,
                () -> order.transitionTo(OrderStatus.COMPLETED, policy, "merchant", null, NOW.plusMinutes(1)));
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertEquals(NOW, order.getUpdatedAt());
    }

    @Test
    @DisplayName("취소 - 사유와 취소 시각 기록")
    void testTransition_Cancel() {
        // Given
        Order order = TestDataFactory.order("CAN00001", 30000L, NOW);

        // When
        order.transitionTo(OrderStatus.CANCELLED, policy, "user:100", "단순 변심", NOW);

        // Then
        assertEquals(OrderStatus.CANCELLED, order.getOrderStatus());
        assertEquals("단순 변심", order.getCancellationReason());
        assertEquals(NOW, order.getCancelledAt());
    }

    // ========== 사용 처리 ==========

    @Test
    @DisplayName("이미 사용된 주문 재사용 - InvalidOrderStatusException")
    void testMarkVerified_AlreadyVerified() {
        // Given
        Order order = TestDataFactory.order("VER00001", 30000L, NOW);
        order.markVerified(policy, "staff-1", NOW);

        // When & Then
        assertThrows(InvalidOrderStatusException.class, () -> order.markVerified(policy, "staff-2", NOW));
        assertEquals("staff-1", order.getStatusChangedBy());
    }

    // ========== 환불 ==========

    @Test
    @DisplayName("환불 거절 - PENDING에서 요청한 환불은 PENDING으로 복원")
    void testRejectRefund_RestoresPending() {
        // Given
        Order order = TestDataFactory.order("RFD00001", 30000L, NOW);
        order.requestRefund(policy, "중복 결제", "두 번 결제됨", List.of("https://cdn/receipt.png"), "user:100", NOW);

        // When
        OrderStatus restored = order.rejectRefund(policy, "결제 1건만 확인됨", "admin-1", NOW.plusHours(1));

        // Then
        assertEquals(OrderStatus.PENDING, restored);
        assertEquals(OrderStatus.PENDING, order.getOrderStatus());
        assertEquals("결제 1건만 확인됨", order.getRefundRejectReason());
        assertEquals("admin-1", order.getRefundProcessedBy());
        assertNull(order.getPreRefundStatus());
        assertEquals(List.of("https://cdn/receipt.png"), order.getRefundEvidence());
    }

    @Test
    @DisplayName("환불 승인 - 결제 완료 주문은 결제 상태도 REFUNDED")
    void testApproveRefund_PaymentRefunded() {
        // Given
        Order order = TestDataFactory.order("RFD00002", 30000L, NOW);
        order.updatePaymentStatus(PaymentStatus.PAID, NOW);
        order.markVerified(policy, "staff-1", NOW);
        order.requestRefund(policy, "품질 불량", null, null, "user:100", NOW);

        // When
        order.approveRefund(policy, "admin-1", NOW.plusHours(2));

        // Then
        assertEquals(OrderStatus.REFUNDED, order.getOrderStatus());
        assertEquals(PaymentStatus.REFUNDED, order.getPaymentStatus());
        assertEquals(NOW.plusHours(2), order.getRefundedAt());
    }

    @Test
    @DisplayName("완료된 주문 환불 요청 - InvalidOrderStatusException, 상태 유지")
    void testRequestRefund_CompletedOrder() {
        // Given
        Order order = TestDataFactory.order("RFD00003", 30000L, NOW);
        order.markVerified(policy, "staff-1", NOW);
        order.transitionTo(OrderStatus.COMPLETED, policy, "system", null, NOW);

        // When & Then
        assertThrows(InvalidOrderStatusException.class,
                () -> order.requestRefund(policy, "환불 원함", null, null, "user:100", NOW));
        assertEquals(OrderStatus.COMPLETED, order.getOrderStatus());
        assertNull(order.getRefundReason());
    }

    // ========== 결제 상태 ==========

    @Test
    @DisplayName("결제 상태 - PAID 최초 수신 시 paidAt 기록, 환불된 결제는 변경 불가")
    void testUpdatePaymentStatus() {
        // Given
        Order order = TestDataFactory.order("PAY00001", 30000L, NOW);

        // When
        order.updatePaymentStatus(PaymentStatus.PAID, NOW.plusMinutes(1));
        order.updatePaymentStatus(PaymentStatus.PAID, NOW.plusMinutes(2));

        // Then
        assertEquals(NOW.plusMinutes(1), order.getPaidAt());

        order.updatePaymentStatus(PaymentStatus.REFUNDED, NOW.plusMinutes(3));
        assertThrows(InvalidOrderStatusException.class,
                () -> order.updatePaymentStatus(PaymentStatus.PAID, NOW.plusMinutes(4)));
    }
}
