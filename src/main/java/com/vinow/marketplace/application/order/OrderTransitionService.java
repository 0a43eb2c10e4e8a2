package com.vinow.marketplace.application.order;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.infrastructure.lock.LockKeyGenerator;
import com.vinow.marketplace.infrastructure.lock.OrderLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * OrderTransitionService - 주문 상태 전환 진입점
 *
 * 동시성 제어 (두 가드를 함께 사용):
 * 1. OrderLockManager: 주문별 락 (LOCAL ReentrantLock / REDIS RLock)
 * 2. 트랜잭션 내부 SELECT ... FOR UPDATE + @Version
 *
 * 같은 원래 상태에서 출발한 두 전환 요청 중 하나만 성공한다.
 * 락 대기 시간 초과는 ConcurrencyConflictException으로 전달되며 자동 재시도하지 않는다.
 *
 * VERIFIED, REFUNDING, REFUNDED는 VerificationService, RefundService의 전용 작업으로만 도달한다.
 * (OrderTransactionService.applyTransition에서 InvalidOrderStatusException으로 거부)
 */
@Slf4j
@Service
public class OrderTransitionService {

    private final OrderLockManager orderLockManager;
    private final OrderTransactionService orderTransactionService;

    public OrderTransitionService(OrderLockManager orderLockManager,
                                  OrderTransactionService orderTransactionService) {
        this.orderLockManager = orderLockManager;
        this.orderTransactionService = orderTransactionService;
    }

    /**
     * 주문 상태 전환
     *
     * @param reason CANCELLED 전환 시 필수
     * @throws com.vinow.marketplace.domain.order.OrderNotFoundException          주문 없음
     * @throws com.vinow.marketplace.domain.order.InvalidOrderTransitionException 간선 없음
     * @throws com.vinow.marketplace.domain.order.InvalidOrderStatusException     전용 작업 대상, 환불 처리 중
     * @throws ValidationException                                                 사유 누락
     * @throws com.vinow.marketplace.common.exception.ConcurrencyConflictException 락 경합 패배
     */
    public Order transition(Long orderId, OrderStatus target, String actor, String reason) {
        if (orderId == null) {
            throw new ValidationException("주문 ID는 필수입니다");
        }
        if (target == null) {
            throw new ValidationException("목표 상태는 필수입니다");
        }

        log.debug("[OrderTransitionService] 상태 전환 요청 - orderId={}, target={}, actor={}", orderId, target, actor);
        return orderLockManager.executeWithLock(LockKeyGenerator.order(orderId),
                () -> orderTransactionService.applyTransition(orderId, target, actor, reason));
    }
}
