package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.common.persistence.StringListJsonConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상태 전환 적용 및 상태별 타임스탬프 기록
 * - 환불 메타데이터 (사유, 설명, 증빙, 처리자, 환불 직전 상태) 관리
 * - 금액 불변식 보장: finalAmount = totalAmount - discountAmount ≥ 0
 *
 * 핵심 비즈니스 규칙:
 * - 상태는 {@link OrderTransitionPolicy}의 간선으로만 변경된다
 * - 검증 코드는 생성 시 한 번 할당되며 변경되지 않는다
 * - 모든 검증을 통과한 뒤에만 필드를 변경한다 (실패한 작업은 주문을 바꾸지 않음)
 * - 금액 필드에는 setter가 없다
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_orders_order_number", columnNames = "order_number"),
                @UniqueConstraint(name = "uk_orders_verification_code", columnNames = "verification_code")
        },
        indexes = {
                @Index(name = "idx_orders_merchant_created", columnList = "merchant_id, created_at"),
                @Index(name = "idx_orders_merchant_status", columnList = "merchant_id, order_status")
        })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {

    public static final String DEFAULT_CURRENCY = "VND";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", nullable = false, updatable = false, length = 40)
    private String orderNumber;

    @Column(name = "merchant_id", nullable = false)
    private Long merchantId;

    @Column(name = "store_id")
    private Long storeId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private Long totalAmount;

    @Column(name = "discount_amount", nullable = false, updatable = false)
    private Long discountAmount;

    @Column(name = "final_amount", nullable = false, updatable = false)
    private Long finalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "payment_method", length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "verification_code", nullable = false, updatable = false, length = 32)
    private String verificationCode;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    // ========== 환불 ==========

    @Column(name = "refund_reason", length = 500)
    private String refundReason;

    @Column(name = "refund_explanation", length = 2000)
    private String refundExplanation;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "refund_evidence", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> refundEvidence = new ArrayList<>();

    @Column(name = "refund_processed_by", length = 100)
    private String refundProcessedBy;

    @Column(name = "refund_reject_reason", length = 500)
    private String refundRejectReason;

    @Column(name = "pre_refund_status", length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus preRefundStatus;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "status_changed_by", length = 100)
    private String statusChangedBy;

    // ========== 타임스탬프 ==========

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "preparing_at")
    private LocalDateTime preparingAt;

    @Column(name = "ready_at")
    private LocalDateTime readyAt;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "refund_requested_at")
    private LocalDateTime refundRequestedAt;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * 주문 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 최소 1개 이상의 항목
     * - 할인액 0 이상, 최종 금액 0 이상
     * - 항목 금액과 총액은 long 범위 안 (초과 시 ValidationException)
     * - 항상 PENDING / 결제 PENDING 상태로 생성
     */
    public static Order createOrder(String orderNumber, Long merchantId, Long storeId, Long userId,
                                    List<OrderItem> items, Long discountAmount, PaymentMethod paymentMethod,
                                    String currency, String verificationCode, LocalDateTime now) {
        if (merchantId == null || userId == null) {
            throw new ValidationException("가맹점 ID와 사용자 ID는 필수입니다");
        }
        if (items == null || items.isEmpty()) {
            throw new ValidationException("주문 항목은 최소 1개 이상이어야 합니다");
        }
        long discount = discountAmount == null ? 0L : discountAmount;
        if (discount < 0) {
            throw new ValidationException("할인액은 음수가 될 수 없습니다");
        }
        long total;
        try {
            total = items.stream().mapToLong(OrderItem::getSubtotal).reduce(0L, Math::addExact);
        } catch (ArithmeticException e) {
            throw new ValidationException("주문 총액이 허용 범위를 넘었습니다 - items=" + items.size(), e);
        }
        if (total - discount < 0) {
            throw new ValidationException(String.format("최종 금액은 음수가 될 수 없습니다 - total=%d, discount=%d",
                    total, discount));
        }

        Order order = Order.builder()
                .orderNumber(orderNumber)
                .merchantId(merchantId)
                .storeId(storeId)
                .userId(userId)
                .orderStatus(OrderStatus.PENDING)
                .totalAmount(total)
                .discountAmount(discount)
                .finalAmount(total - discount)
                .currency(currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency)
                .paymentMethod(paymentMethod)
                .paymentStatus(PaymentStatus.PENDING)
                .verificationCode(verificationCode)
                .createdAt(now)
                .updatedAt(now)
                .build();
        items.forEach(order::addOrderItem);
        return order;
    }

    private void addOrderItem(OrderItem orderItem) {
        orderItem.assignOrder(this);
        this.orderItems.add(orderItem);
    }

    public List<String> getRefundEvidence() {
        return refundEvidence == null ? List.of() : Collections.unmodifiableList(refundEvidence);
    }

    public boolean belongsTo(Long merchantId) {
        return this.merchantId.equals(merchantId);
    }

    // ========== 상태 전환 ==========

    /**
     * 상태 전환 적용
     *
     * 상태별 부수 효과:
     * - CONFIRMED/PREPARING/READY/VERIFIED/COMPLETED: 해당 타임스탬프 기록
     * - CANCELLED: cancelledAt, 취소 사유
     * - REFUNDING: 환불 직전 상태 저장, 환불 사유, 요청 시각
     * - REFUNDED: refundedAt, 처리자, 결제 상태 REFUNDED
     * - REFUNDING → PENDING/VERIFIED (거절): 거절 사유, 처리자
     *
     * @throws InvalidOrderTransitionException 간선이 없을 때 (주문은 변경되지 않음)
     * @throws ValidationException             필요한 사유가 없을 때 (주문은 변경되지 않음)
     */
    public void transitionTo(OrderStatus target, OrderTransitionPolicy policy,
                             String actor, String reason, LocalDateTime now) {
        policy.validate(this, target, reason);

        OrderStatus current = this.orderStatus;
        if (current == OrderStatus.REFUNDING && target != OrderStatus.REFUNDED) {
            this.refundRejectReason = reason;
            this.refundProcessedBy = actor;
            this.preRefundStatus = null;
        } else {
            switch (target) {
                case CONFIRMED -> this.confirmedAt = now;
                case PREPARING -> this.preparingAt = now;
                case READY -> this.readyAt = now;
                case VERIFIED -> this.verifiedAt = now;
                case COMPLETED -> this.completedAt = now;
                case CANCELLED -> {
                    this.cancelledAt = now;
                    this.cancellationReason = reason;
                }
                case REFUNDING -> {
                    this.preRefundStatus = current;
                    this.refundReason = reason;
                    this.refundRequestedAt = now;
                    this.refundRejectReason = null;
                    this.refundProcessedBy = null;
                }
                case REFUNDED -> {
                    this.refundedAt = now;
                    this.refundProcessedBy = actor;
                    if (this.paymentStatus == PaymentStatus.PAID) {
                        this.paymentStatus = PaymentStatus.REFUNDED;
                    }
                }
                default -> {
                    // PENDING은 복원 경로로만 도달
                }
            }
        }

        this.orderStatus = target;
        this.statusChangedBy = actor;
        this.updatedAt = now;
    }

    /**
     * 사용(검증) 처리: 사용 가능 상태 → VERIFIED
     *
     * @throws InvalidOrderStatusException 사용 가능 상태가 아닐 때 (이미 사용된 주문 포함)
     */
    public void markVerified(OrderTransitionPolicy policy, String staffId, LocalDateTime now) {
        if (!policy.isRedeemable(this.orderStatus)) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, "VERIFY");
        }
        transitionTo(OrderStatus.VERIFIED, policy, staffId, null, now);
    }

    /**
     * 환불 요청: PENDING | VERIFIED → REFUNDING
     *
     * @throws InvalidOrderStatusException PENDING, VERIFIED 이외의 상태
     */
    public void requestRefund(OrderTransitionPolicy policy, String reason, String explanation,
                              List<String> evidence, String requestedBy, LocalDateTime now) {
        if (!policy.canTransition(this, OrderStatus.REFUNDING)) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, "REQUEST_REFUND");
        }
        transitionTo(OrderStatus.REFUNDING, policy, requestedBy, reason, now);
        this.refundExplanation = explanation;
        this.refundEvidence = evidence == null ? new ArrayList<>() : new ArrayList<>(evidence);
    }

    /**
     * 환불 승인: REFUNDING → REFUNDED
     */
    public void approveRefund(OrderTransitionPolicy policy, String processedBy, LocalDateTime now) {
        if (this.orderStatus != OrderStatus.REFUNDING) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, "APPROVE_REFUND");
        }
        transitionTo(OrderStatus.REFUNDED, policy, processedBy, null, now);
    }

    /**
     * 환불 거절: REFUNDING → 환불 직전 상태
     *
     * @return 복원된 상태
     */
    public OrderStatus rejectRefund(OrderTransitionPolicy policy, String rejectReason,
                                    String processedBy, LocalDateTime now) {
        if (this.orderStatus != OrderStatus.REFUNDING) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, "REJECT_REFUND");
        }
        if (rejectReason == null || rejectReason.isBlank()) {
            throw new ValidationException("환불 거절 사유는 필수입니다 - orderId=" + this.orderId);
        }
        OrderStatus restoreTo = policy.restoreTargetOf(this);
        transitionTo(restoreTo, policy, processedBy, rejectReason, now);
        return restoreTo;
    }

    /**
     * 결제 상태 갱신 (결제/에스크로 협력 시스템 통지)
     *
     * 비즈니스 규칙:
     * - REFUNDED 결제는 더 이상 변경 불가
     * - PAID 최초 수신 시 paidAt 기록
     */
    public void updatePaymentStatus(PaymentStatus newStatus, LocalDateTime now) {
        if (newStatus == null) {
            throw new ValidationException("결제 상태는 필수입니다");
        }
        if (this.paymentStatus == PaymentStatus.REFUNDED && newStatus != PaymentStatus.REFUNDED) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, "UPDATE_PAYMENT_STATUS");
        }
        if (newStatus == PaymentStatus.PAID && this.paidAt == null) {
            this.paidAt = now;
        }
        this.paymentStatus = newStatus;
        this.updatedAt = now;
    }

    // ========== 저장소 지원 ==========

    /**
     * 메모리 저장소의 ID 할당 (JPA는 IDENTITY 전략 사용)
     */
    public void assignId(Long orderId) {
        this.orderId = orderId;
    }

    public void assignItemIds(LongSupplier idSupplier) {
        for (OrderItem item : orderItems) {
            if (item.getOrderItemId() == null) {
                item.assignId(idSupplier.getAsLong());
            }
        }
    }
}
