package com.vinow.marketplace.domain.refund;

import com.vinow.marketplace.common.persistence.StringListJsonConverter;
import com.vinow.marketplace.domain.order.Order;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * RefundRecord - 환불 원장
 *
 * 주문에 포함된 환불 필드와 별도로, 요청 1건마다 한 행을 남긴다.
 * 같은 주문이 거절 후 다시 요청되면 새 행이 생성된다.
 *
 * 상태 전환:
 * REQUESTED → APPROVED
 * REQUESTED → REJECTED
 */
@Entity
@Table(name = "refund_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_refund_records_refund_no", columnNames = "refund_no"),
        indexes = @Index(name = "idx_refund_records_order", columnList = "order_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RefundRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "refund_record_id")
    private Long refundRecordId;

    @Column(name = "refund_no", nullable = false, updatable = false, length = 40)
    private String refundNo;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "amount", nullable = false, updatable = false)
    private Long amount;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "explanation", length = 2000)
    private String explanation;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "evidence", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private RefundStatus status;

    @Column(name = "processed_by", length = 100)
    private String processedBy;

    @Column(name = "reject_reason", length = 500)
    private String rejectReason;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private LocalDateTime requestedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public static RefundRecord request(String refundNo, Order order, LocalDateTime now) {
        return RefundRecord.builder()
                .refundNo(refundNo)
                .orderId(order.getOrderId())
                .merchantId(order.getMerchantId())
                .amount(order.getFinalAmount())
                .reason(order.getRefundReason())
                .explanation(order.getRefundExplanation())
                .evidence(new ArrayList<>(order.getRefundEvidence()))
                .status(RefundStatus.REQUESTED)
                .requestedAt(now)
                .build();
    }

    public void approve(String processedBy, LocalDateTime now) {
        ensureRequested();
        this.status = RefundStatus.APPROVED;
        this.processedBy = processedBy;
        this.processedAt = now;
    }

    public void reject(String rejectReason, String processedBy, LocalDateTime now) {
        ensureRequested();
        this.status = RefundStatus.REJECTED;
        this.rejectReason = rejectReason;
        this.processedBy = processedBy;
        this.processedAt = now;
    }

    private void ensureRequested() {
        if (this.status != RefundStatus.REQUESTED) {
            throw new IllegalStateException(String.format("이미 처리된 환불 기록입니다 - refundNo=%s, status=%s",
                    refundNo, status));
        }
    }

    public void assignId(Long refundRecordId) {
        this.refundRecordId = refundRecordId;
    }
}
