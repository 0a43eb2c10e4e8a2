package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.exception.ValidationException;
import com.vinow.marketplace.common.persistence.LongListJsonConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * ReconciliationLog - 가맹점 일별 대사 결과
 *
 * 비교 대상:
 * - expected: 해당 영업일에 사용(verifiedAt) 처리된 주문의 finalAmount 합계
 * - actual: 해당 영업일에 생성된 VerificationRecord의 주문 finalAmount 합계
 *
 * 불일치 주문:
 * - 사용 처리되었지만 검증 기록이 없는 주문
 * - 검증 기록은 있지만 해당 일자 사용 주문이 아닌 주문
 * - 검증 기록이 2건 이상인 주문
 *
 * 상태: discrepancy == 0 이고 불일치 주문이 없으면 MATCHED, 아니면 MISMATCHED
 */
@Entity
@Table(name = "reconciliation_logs",
        uniqueConstraints = @UniqueConstraint(name = "uk_reconciliation_logs_merchant_date",
                columnNames = {"merchant_id", "business_date"}))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconciliationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "reconciliation_id")
    private Long reconciliationId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "business_date", nullable = false, updatable = false)
    private LocalDate businessDate;

    @Column(name = "expected_total", nullable = false)
    private Long expectedTotal;

    @Column(name = "actual_total", nullable = false)
    private Long actualTotal;

    @Column(name = "discrepancy", nullable = false)
    private Long discrepancy;

    @Column(name = "expected_count", nullable = false)
    private Integer expectedCount;

    @Column(name = "actual_count", nullable = false)
    private Integer actualCount;

    @Convert(converter = LongListJsonConverter.class)
    @Column(name = "mismatched_order_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<Long> mismatchedOrderIds = new ArrayList<>();

    @Convert(converter = LongListJsonConverter.class)
    @Column(name = "resolved_order_ids", columnDefinition = "TEXT")
    @Builder.Default
    private List<Long> resolvedOrderIds = new ArrayList<>();

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private ReconciliationStatus status;

    @Column(name = "reconciled_at", nullable = false)
    private LocalDateTime reconciledAt;

    /**
     * 대사 계산
     *
     * @param expectedAmounts  해당일 사용 처리된 주문 ID → finalAmount
     * @param recordedOrderIds 해당일 검증 기록의 주문 ID (중복 포함)
     * @param orderAmounts     검증 기록 주문 ID → finalAmount
     */
    public static ReconciliationLog compute(Long merchantId, LocalDate businessDate,
                                            Map<Long, Long> expectedAmounts, List<Long> recordedOrderIds,
                                            Map<Long, Long> orderAmounts, LocalDateTime now) {
        long expectedTotal = expectedAmounts.values().stream().mapToLong(Long::longValue).sum();
        long actualTotal = 0L;
        Map<Long, Integer> recordCounts = new HashMap<>();
        for (Long orderId : recordedOrderIds) {
            actualTotal += orderAmounts.getOrDefault(orderId, 0L);
            recordCounts.merge(orderId, 1, Integer::sum);
        }

        Set<Long> mismatched = new TreeSet<>();
        for (Long orderId : expectedAmounts.keySet()) {
            if (!recordCounts.containsKey(orderId)) {
                mismatched.add(orderId);
            }
        }
        recordCounts.forEach((orderId, count) -> {
            if (count > 1 || !expectedAmounts.containsKey(orderId)) {
                mismatched.add(orderId);
            }
        });

        long discrepancy = expectedTotal - actualTotal;
        return ReconciliationLog.builder()
                .merchantId(merchantId)
                .businessDate(businessDate)
                .expectedTotal(expectedTotal)
                .actualTotal(actualTotal)
                .discrepancy(discrepancy)
                .expectedCount(expectedAmounts.size())
                .actualCount(recordedOrderIds.size())
                .mismatchedOrderIds(new ArrayList<>(mismatched))
                .resolvedOrderIds(new ArrayList<>())
                .status(discrepancy == 0 && mismatched.isEmpty()
                        ? ReconciliationStatus.MATCHED : ReconciliationStatus.MISMATCHED)
                .reconciledAt(now)
                .build();
    }

    /**
     * 강제 재대사: 같은 (가맹점, 영업일) 행을 새 계산값으로 갱신
     *
     * 이미 이의 제기된 주문 중 여전히 불일치인 주문은 해결 목록에 유지한다.
     */
    public void recomputeFrom(ReconciliationLog recalculated) {
        if (!merchantId.equals(recalculated.merchantId) || !businessDate.equals(recalculated.businessDate)) {
            throw new IllegalArgumentException("다른 가맹점/영업일의 대사 결과로 갱신할 수 없습니다");
        }
        this.expectedTotal = recalculated.expectedTotal;
        this.actualTotal = recalculated.actualTotal;
        this.discrepancy = recalculated.discrepancy;
        this.expectedCount = recalculated.expectedCount;
        this.actualCount = recalculated.actualCount;
        this.mismatchedOrderIds = new ArrayList<>(recalculated.mismatchedOrderIds);
        this.resolvedOrderIds = new ArrayList<>(resolvedOrderIds);
        this.resolvedOrderIds.retainAll(this.mismatchedOrderIds);
        this.reconciledAt = recalculated.reconciledAt;
        this.status = recalculated.status;
        refreshResolution();
    }

    /**
     * 이의 제기 접수
     *
     * 비즈니스 규칙:
     * - MISMATCHED 상태에서만 가능
     * - 대상 주문은 모두 불일치 주문이어야 함
     * - 불일치 주문 전체가 해결 목록에 들어가면 RESOLVED
     */
    public void registerDispute(List<Long> orderIds) {
        if (status != ReconciliationStatus.MISMATCHED) {
            throw new InvalidReconciliationStatusException(reconciliationId, status);
        }
        if (orderIds == null || orderIds.isEmpty()) {
            throw new ValidationException("이의 제기 대상 주문은 최소 1건 이상이어야 합니다");
        }
        for (Long orderId : orderIds) {
            if (!mismatchedOrderIds.contains(orderId)) {
                throw new ValidationException(String.format("불일치 주문이 아닙니다 - reconciliationId=%d, orderId=%d",
                        reconciliationId, orderId));
            }
        }

        Set<Long> merged = new LinkedHashSet<>(resolvedOrderIds);
        merged.addAll(orderIds);
        this.resolvedOrderIds = new ArrayList<>(merged);
        refreshResolution();
    }

    private void refreshResolution() {
        if (status == ReconciliationStatus.MATCHED || mismatchedOrderIds.isEmpty()) {
            return;
        }
        this.status = resolvedOrderIds.containsAll(mismatchedOrderIds)
                ? ReconciliationStatus.RESOLVED
                : ReconciliationStatus.MISMATCHED;
    }

    public void assignId(Long reconciliationId) {
        this.reconciliationId = reconciliationId;
    }
}
