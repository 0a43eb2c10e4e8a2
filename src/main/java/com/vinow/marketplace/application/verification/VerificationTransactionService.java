package com.vinow.marketplace.application.verification;

import com.vinow.marketplace.domain.order.InvalidOrderStatusException;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderNotFoundException;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import com.vinow.marketplace.domain.verification.VerificationMethod;
import com.vinow.marketplace.domain.verification.VerificationRecord;
import com.vinow.marketplace.domain.verification.VerificationRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 주문 1건 사용(검증) 트랜잭션
 *
 * 하나의 트랜잭션에서:
 * - 주문 상태 VERIFIED 전환
 * - VerificationRecord 1건 추가
 */
@Slf4j
@Service
public class VerificationTransactionService {

    private final OrderRepository orderRepository;
    private final VerificationRecordRepository verificationRecordRepository;
    private final OrderTransitionPolicy transitionPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public VerificationTransactionService(OrderRepository orderRepository,
                                          VerificationRecordRepository verificationRecordRepository,
                                          OrderTransitionPolicy transitionPolicy,
                                          ApplicationEventPublisher eventPublisher,
                                          Clock clock) {
        this.orderRepository = orderRepository;
        this.verificationRecordRepository = verificationRecordRepository;
        this.transitionPolicy = transitionPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public Order verify(Long orderId, String staffId, String staffName, VerificationMethod method) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        // 기록이 이미 있으면 상태와 무관하게 재사용 불가
        if (verificationRecordRepository.countByOrderId(orderId) > 0) {
            throw new InvalidOrderStatusException(orderId, order.getOrderStatus(), "VERIFY");
        }

        OrderStatus fromStatus = order.getOrderStatus();
        LocalDateTime now = LocalDateTime.now(clock);
        order.markVerified(transitionPolicy, staffId, now);
        Order savedOrder = orderRepository.save(order);
        verificationRecordRepository.save(VerificationRecord.of(savedOrder, staffId, staffName, method, now));
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(savedOrder, fromStatus, staffId, null));

        log.info("[VerificationTransactionService] 주문 사용 처리 - orderId={}, {} → VERIFIED, staffId={}, method={}",
                orderId, fromStatus, staffId, method);
        return savedOrder;
    }
}
