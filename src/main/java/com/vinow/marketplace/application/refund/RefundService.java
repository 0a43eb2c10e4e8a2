package com.vinow.marketplace.application.refund;

import com.vinow.marketplace.application.refund.dto.RefundStats;
import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.infrastructure.lock.LockKeyGenerator;
import com.vinow.marketplace.infrastructure.lock.OrderLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * RefundService - 환불 요청/승인/거절
 *
 * 상태 전환:
 * - 요청: PENDING | VERIFIED → REFUNDING (환불 직전 상태 저장)
 * - 승인: REFUNDING → REFUNDED (refundedAt, 처리자 기록)
 * - 거절: REFUNDING → 저장된 환불 직전 상태 (PENDING 또는 VERIFIED)
 *
 * 세 작업 모두 주문 락 + 트랜잭션 안에서 현재 상태를 다시 확인하므로
 * 동시에 호출되어도 기대한 원래 상태가 아닌 주문에는 적용되지 않는다.
 */
@Slf4j
@Service
public class RefundService {

    private final OrderRepository orderRepository;
    private final RefundTransactionService refundTransactionService;
    private final OrderLockManager orderLockManager;
    private final Clock clock;

    public RefundService(OrderRepository orderRepository,
                         RefundTransactionService refundTransactionService,
                         OrderLockManager orderLockManager,
                         Clock clock) {
        this.orderRepository = orderRepository;
        this.refundTransactionService = refundTransactionService;
        this.orderLockManager = orderLockManager;
        this.clock = clock;
    }

    public Order requestRefund(Long orderId, String reason, String explanation, List<String> evidence) {
        return requestRefund(orderId, reason, explanation, evidence, null);
    }

    /**
     * @param requestedBy null이면 주문 사용자
     */
    public Order requestRefund(Long orderId, String reason, String explanation, List<String> evidence,
                               String requestedBy) {
        requireOrderId(orderId);
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("환불 사유는 필수입니다 - orderId=" + orderId);
        }
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> refundTransactionService.request(orderId, reason, explanation, evidence, requestedBy));
    }

    public Order approveRefund(Long orderId, String processedBy) {
        requireOrderId(orderId);
        requireProcessor(processedBy);
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> refundTransactionService.approve(orderId, processedBy));
    }

    public Order rejectRefund(Long orderId, String rejectReason, String processedBy) {
        requireOrderId(orderId);
        requireProcessor(processedBy);
        if (rejectReason == null || rejectReason.isBlank()) {
            throw new ValidationException("환불 거절 사유는 필수입니다 - orderId=" + orderId);
        }
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> refundTransactionService.reject(orderId, rejectReason, processedBy));
    }

    // ========== 조회 ==========

    /**
     * 처리 대기 환불 (REFUNDING), 최근 수정순
     */
    @Transactional(readOnly = true)
    public List<Order> getPendingRefunds(Long merchantId, int page, int size) {
        if (page < 0 || size < 1 || size > 100) {
            throw new ValidationException("page는 0 이상, size는 1~100 사이여야 합니다");
        }
        return orderRepository.findByMerchantIdAndStatusOrderByUpdatedAtDesc(merchantId, OrderStatus.REFUNDING,
                page, size);
    }

    @Transactional(readOnly = true)
    public RefundStats getRefundStats(Long merchantId, int days) {
        if (days < 1 || days > 365) {
            throw new ValidationException("조회 기간은 1~365일 사이여야 합니다");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        List<Order> orders = orderRepository.findByMerchantIdAndUpdatedAtAfter(merchantId, since);

        long pendingCount = 0L;
        long refundedCount = 0L;
        long refundedAmount = 0L;
        Map<String, Long> reasonCounts = new TreeMap<>();
        for (Order order : orders) {
            if (order.getOrderStatus() == OrderStatus.REFUNDING) {
                pendingCount++;
            } else if (order.getOrderStatus() == OrderStatus.REFUNDED
                    && order.getRefundedAt() != null && !order.getRefundedAt().isBefore(since)) {
                refundedCount++;
                refundedAmount += order.getFinalAmount();
            }
            if (order.getRefundReason() != null && order.getRefundRequestedAt() != null
                    && !order.getRefundRequestedAt().isBefore(since)) {
                reasonCounts.merge(order.getRefundReason(), 1L, Long::sum);
            }
        }

        return RefundStats.builder()
                .periodDays(days)
                .pendingCount(pendingCount)
                .refundedCount(refundedCount)
                .refundedAmount(refundedAmount)
                .reasonCounts(reasonCounts)
                .build();
    }

    private void requireOrderId(Long orderId) {
        if (orderId == null) {
            throw new ValidationException("주문 ID는 필수입니다");
        }
    }

    private void requireProcessor(String processedBy) {
        if (processedBy == null || processedBy.isBlank()) {
            throw new ValidationException("처리자는 필수입니다");
        }
    }
}
