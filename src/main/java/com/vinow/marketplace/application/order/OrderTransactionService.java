package com.vinow.marketplace.application.order;

import com.vinow.marketplace.domain.order.InvalidOrderStatusException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderNotFoundException;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import com.vinow.marketplace.domain.order.PaymentStatus;
import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * OrderTransactionService - 주문 변경 트랜잭션 처리 (Application 계층)
 *
 * 역할:
 * - OrderTransitionService / OrderService와 분리된 트랜잭션 경계
 * - @Transactional이 프록시를 통해 정상 작동하도록 별도 Bean으로 둔다
 *
 * 아키텍처:
 * OrderTransitionService (주문 락 획득)
 *     ↓
 * OrderTransactionService (SELECT ... FOR UPDATE → 도메인 메서드 → 저장 → 이벤트)
 */
@Slf4j
@Service
public class OrderTransactionService {

    private final OrderRepository orderRepository;
    private final OrderTransitionPolicy transitionPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public OrderTransactionService(OrderRepository orderRepository,
                                   OrderTransitionPolicy transitionPolicy,
                                   ApplicationEventPublisher eventPublisher,
                                   Clock clock) {
        this.orderRepository = orderRepository;
        this.transitionPolicy = transitionPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 상태 전환 적용
     *
     * VERIFIED, REFUNDING, REFUNDED 도달과 REFUNDING 이탈은 전용 작업으로만 가능하다.
     */
    @Transactional
    public Order applyTransition(Long orderId, OrderStatus target, String actor, String reason) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus fromStatus = order.getOrderStatus();
        String dedicatedOperation = dedicatedOperation(fromStatus, target);
        if (dedicatedOperation != null) {
            throw new InvalidOrderStatusException(orderId, fromStatus,
                    "TRANSITION_TO_" + target + " (" + dedicatedOperation + " 사용)");
        }

        order.transitionTo(target, transitionPolicy, actor, reason, LocalDateTime.now(clock));
        Order savedOrder = orderRepository.save(order);
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(savedOrder, fromStatus, actor, reason));

        log.info("[OrderTransactionService] 상태 전환 완료 - orderId={}, {} → {}, actor={}",
                orderId, fromStatus, target, actor);
        return savedOrder;
    }

    @Transactional
    public Order applyPaymentStatus(Long orderId, PaymentStatus paymentStatus) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        PaymentStatus before = order.getPaymentStatus();
        order.updatePaymentStatus(paymentStatus, LocalDateTime.now(clock));
        Order savedOrder = orderRepository.save(order);

        log.info("[OrderTransactionService] 결제 상태 갱신 - orderId={}, {} → {}", orderId, before, paymentStatus);
        return savedOrder;
    }

    private static String dedicatedOperation(OrderStatus fromStatus, OrderStatus target) {
        if (fromStatus == OrderStatus.REFUNDING) {
            return "approveRefund/rejectRefund";
        }
        return switch (target) {
            case VERIFIED -> "verifyByCode/verifyByQR";
            case REFUNDING -> "requestRefund";
            case REFUNDED -> "approveRefund";
            default -> null;
        };
    }
}
