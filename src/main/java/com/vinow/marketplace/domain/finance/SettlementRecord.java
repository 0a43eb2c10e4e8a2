package com.vinow.marketplace.domain.finance;

import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * SettlementRecord - 가맹점 주간 정산 기록
 *
 * 비즈니스 규칙:
 * - (merchant_id, period_start, period_end)당 1건, 금액은 생성 후 변경 불가
 * - grossAmount = Σ 일별 totalIncome
 * - commission = Σ 일별 platformFee
 * - refundAmount = Σ 일별 refundAmount
 * - netPayable = grossAmount - commission - refundAmount
 *
 * 상태 전환: PROCESSING → COMPLETED | FAILED, FAILED → COMPLETED (재실행)
 */
@Entity
@Table(name = "settlement_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_settlement_records_no", columnNames = "settlement_no"),
                @UniqueConstraint(name = "uk_settlement_records_period",
                        columnNames = {"merchant_id", "period_start", "period_end"})
        })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "settlement_id")
    private Long settlementId;

    @Column(name = "settlement_no", nullable = false, updatable = false, length = 40)
    private String settlementNo;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private Long grossAmount;

    @Column(name = "commission", nullable = false, updatable = false)
    private Long commission;

    @Column(name = "refund_amount", nullable = false, updatable = false)
    private Long refundAmount;

    @Column(name = "net_payable", nullable = false, updatable = false)
    private Long netPayable;

    @Column(name = "summary_count", nullable = false, updatable = false)
    private Integer summaryCount;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private SettlementStatus status;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private LocalDateTime generatedAt;

    @Column(name = "settled_at")
    private LocalDateTime settledAt;

    /**
     * 일별 요약으로 정산 기록 생성 (PROCESSING)
     */
    public static SettlementRecord open(String settlementNo, Long merchantId, LocalDate periodStart,
                                        LocalDate periodEnd, List<FinanceDailySummary> summaries,
                                        LocalDateTime now) {
        long gross = summaries.stream().mapToLong(FinanceDailySummary::getTotalIncome).sum();
        long commission = summaries.stream().mapToLong(FinanceDailySummary::getPlatformFee).sum();
        long refund = summaries.stream().mapToLong(FinanceDailySummary::getRefundAmount).sum();

        return SettlementRecord.builder()
                .settlementNo(settlementNo)
                .merchantId(merchantId)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .grossAmount(gross)
                .commission(commission)
                .refundAmount(refund)
                .netPayable(gross - commission - refund)
                .summaryCount(summaries.size())
                .status(SettlementStatus.PROCESSING)
                .generatedAt(now)
                .build();
    }

    public boolean isCompleted() {
        return status == SettlementStatus.COMPLETED;
    }

    public void complete(LocalDateTime now) {
        if (status == SettlementStatus.COMPLETED) {
            throw new InvalidSettlementStatusException(settlementNo, status, "COMPLETE");
        }
        this.status = SettlementStatus.COMPLETED;
        this.failureReason = null;
        this.settledAt = now;
    }

    public void fail(String reason) {
        if (status == SettlementStatus.COMPLETED) {
            throw new InvalidSettlementStatusException(settlementNo, status, "FAIL");
        }
        this.status = SettlementStatus.FAILED;
        this.failureReason = reason;
    }

    /**
     * 다음 정산 예정일 (기간 종료일 다음 월요일)
     */
    public LocalDate nextSettlementDate() {
        return periodEnd.with(TemporalAdjusters.next(DayOfWeek.MONDAY));
    }

    public void assignId(Long settlementId) {
        this.settlementId = settlementId;
    }
}
