package com.vinow.marketplace.application.refund;

import com.vinow.marketplace.common.id.BusinessIdGenerator;
import com.vinow.marketplace.common.id.IdPrefix;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderNotFoundException;
import com.vinow.marketplace.domain.order.OrderRepository;
import com.vinow.marketplace.domain.order.OrderStatus;
import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import com.vinow.marketplace.domain.refund.RefundRecord;
import com.vinow.marketplace.domain.refund.RefundRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 환불 단계별 트랜잭션 (주문 상태 + 환불 원장)
 *
 * 원장 행(RefundRecord):
 * - 요청 시 REQUESTED로 생성
 * - 승인/거절 시 같은 행을 APPROVED/REJECTED로 갱신
 */
@Slf4j
@Service
public class RefundTransactionService {

    private final OrderRepository orderRepository;
    private final RefundRecordRepository refundRecordRepository;
    private final OrderTransitionPolicy transitionPolicy;
    private final BusinessIdGenerator idGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public RefundTransactionService(OrderRepository orderRepository,
                                    RefundRecordRepository refundRecordRepository,
                                    OrderTransitionPolicy transitionPolicy,
                                    BusinessIdGenerator idGenerator,
                                    ApplicationEventPublisher eventPublisher,
                                    Clock clock) {
        this.orderRepository = orderRepository;
        this.refundRecordRepository = refundRecordRepository;
        this.transitionPolicy = transitionPolicy;
        this.idGenerator = idGenerator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public Order request(Long orderId, String reason, String explanation, List<String> evidence, String requestedBy) {
        Order order = loadForUpdate(orderId);
        String actor = requestedBy != null ? requestedBy : "user:" + order.getUserId();

        OrderStatus fromStatus = order.getOrderStatus();
        LocalDateTime now = LocalDateTime.now(clock);
        order.requestRefund(transitionPolicy, reason, explanation, evidence, actor, now);
        Order savedOrder = orderRepository.save(order);

        RefundRecord refundRecord = refundRecordRepository.save(
                RefundRecord.request(idGenerator.next(IdPrefix.REFUND), savedOrder, now));
        eventPublisher.publishEvent(OrderStatusChangedEvent.of(savedOrder, fromStatus, actor, reason));

        log.info("[RefundTransactionService] 환불 요청 - orderId={}, refundNo={}, {} → REFUNDING, amount={}",
                orderId, refundRecord.getRefundNo(), fromStatus, savedOrder.getFinalAmount());
        return savedOrder;
    }

    @Transactional
    public Order approve(Long orderId, String processedBy) {
        Order order = loadForUpdate(orderId);

        LocalDateTime now = LocalDateTime.now(clock);
        order.approveRefund(transitionPolicy, processedBy, now);
        Order savedOrder = orderRepository.save(order);

        openLedger(orderId).ifPresent(record -> {
            record.approve(processedBy, now);
            refundRecordRepository.save(record);
        });
        eventPublisher.publishEvent(
                OrderStatusChangedEvent.of(savedOrder, OrderStatus.REFUNDING, processedBy, null));

        log.info("[RefundTransactionService] 환불 승인 - orderId={}, processedBy={}, refundedAt={}",
                orderId, processedBy, savedOrder.getRefundedAt());
        return savedOrder;
    }

    @Transactional
    public Order reject(Long orderId, String rejectReason, String processedBy) {
        Order order = loadForUpdate(orderId);

        LocalDateTime now = LocalDateTime.now(clock);
        OrderStatus restored = order.rejectRefund(transitionPolicy, rejectReason, processedBy, now);
        Order savedOrder = orderRepository.save(order);

        openLedger(orderId).ifPresent(record -> {
            record.reject(rejectReason, processedBy, now);
            refundRecordRepository.save(record);
        });
        eventPublisher.publishEvent(
                OrderStatusChangedEvent.of(savedOrder, OrderStatus.REFUNDING, processedBy, rejectReason));

        log.info("[RefundTransactionService] 환불 거절 - orderId={}, REFUNDING → {}, processedBy={}",
                orderId, restored, processedBy);
        return savedOrder;
    }

    private Order loadForUpdate(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private Optional<RefundRecord> openLedger(Long orderId) {
        Optional<RefundRecord> record = refundRecordRepository.findOpenByOrderId(orderId);
        if (record.isEmpty()) {
            log.warn("[RefundTransactionService] 처리 대기 환불 원장 없음 - orderId={}", orderId);
        }
        return record;
    }
}
