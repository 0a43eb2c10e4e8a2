package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.persistence.LongListJsonConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * DisputeRecord - 대사 불일치 이의 제기 (접수 후 변경 없음)
 */
@Entity
@Table(name = "dispute_records",
        indexes = @Index(name = "idx_dispute_records_reconciliation", columnList = "reconciliation_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DisputeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dispute_id")
    private Long disputeId;

    @Column(name = "reconciliation_id", nullable = false, updatable = false)
    private Long reconciliationId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Convert(converter = LongListJsonConverter.class)
    @Column(name = "order_ids", nullable = false, updatable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<Long> orderIds = new ArrayList<>();

    @Column(name = "reason", nullable = false, updatable = false, length = 1000)
    private String reason;

    @Column(name = "submitted_by", updatable = false, length = 100)
    private String submittedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static DisputeRecord submit(ReconciliationLog log, List<Long> orderIds, String reason,
                                       String submittedBy, LocalDateTime now) {
        return DisputeRecord.builder()
                .reconciliationId(log.getReconciliationId())
                .merchantId(log.getMerchantId())
                .orderIds(new ArrayList<>(orderIds))
                .reason(reason)
                .submittedBy(submittedBy)
                .createdAt(now)
                .build();
    }

    public void assignId(Long disputeId) {
        this.disputeId = disputeId;
    }
}
