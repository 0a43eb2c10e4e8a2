package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.persistence.LongMapJsonConverter;
import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * FinanceDailySummary - 가맹점 일별 매출 요약
 *
 * 집계 대상: 해당 영업일에 생성된 주문
 *
 * 계산 규칙:
 * - 성공 주문: VERIFIED, COMPLETED
 * - totalIncome = Σ 성공 주문 finalAmount
 * - platformFee = round_half_up(totalIncome × 수수료율)
 * - netIncome = totalIncome - platformFee
 * - refundAmount = Σ REFUNDED 주문 finalAmount
 * - couponDeduction = Σ discountAmount
 * - settlementAmount = netIncome - refundAmount
 * - 결제수단별 매출 = 성공 주문 finalAmount를 결제수단으로 분류
 *
 * (merchant_id, summary_date) 유니크: 재실행 시 같은 행을 갱신한다.
 */
@Entity
@Table(name = "finance_daily_summaries",
        uniqueConstraints = @UniqueConstraint(name = "uk_finance_daily_summaries_merchant_date",
                columnNames = {"merchant_id", "summary_date"}))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FinanceDailySummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "summary_id")
    private Long summaryId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private Long merchantId;

    @Column(name = "summary_date", nullable = false, updatable = false)
    private LocalDate summaryDate;

    @Column(name = "order_count", nullable = false)
    private Integer orderCount;

    @Column(name = "successful_orders", nullable = false)
    private Integer successfulOrders;

    @Column(name = "failed_orders", nullable = false)
    private Integer failedOrders;

    @Column(name = "total_income", nullable = false)
    private Long totalIncome;

    @Column(name = "platform_fee", nullable = false)
    private Long platformFee;

    @Column(name = "net_income", nullable = false)
    private Long netIncome;

    @Column(name = "refund_amount", nullable = false)
    private Long refundAmount;

    @Column(name = "coupon_deduction", nullable = false)
    private Long couponDeduction;

    @Column(name = "settlement_amount", nullable = false)
    private Long settlementAmount;

    @Convert(converter = LongMapJsonConverter.class)
    @Column(name = "payment_method_breakdown", columnDefinition = "TEXT")
    private Map<String, Long> paymentMethodBreakdown;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 목록으로 일별 요약 계산
     *
     * @param orders 해당 가맹점, 해당 영업일에 생성된 주문 (비어 있으면 안 됨)
     */
    public static FinanceDailySummary calculate(Long merchantId, LocalDate summaryDate, List<Order> orders,
                                                BigDecimal platformFeeRate, LocalDateTime now) {
        if (orders == null || orders.isEmpty()) {
            throw new IllegalArgumentException("집계할 주문이 없습니다 - merchantId=" + merchantId);
        }

        long totalIncome = 0L;
        long refundAmount = 0L;
        long couponDeduction = 0L;
        int successful = 0;
        Map<String, Long> breakdown = new TreeMap<>();

        for (Order order : orders) {
            couponDeduction += order.getDiscountAmount();
            if (isSuccessful(order.getOrderStatus())) {
                successful++;
                totalIncome += order.getFinalAmount();
                String method = order.getPaymentMethod() == null ? "UNKNOWN" : order.getPaymentMethod().name();
                breakdown.merge(method, order.getFinalAmount(), Long::sum);
            } else if (order.getOrderStatus() == OrderStatus.REFUNDED) {
                refundAmount += order.getFinalAmount();
            }
        }

        long platformFee = BigDecimal.valueOf(totalIncome)
                .multiply(platformFeeRate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        long netIncome = totalIncome - platformFee;

        return FinanceDailySummary.builder()
                .merchantId(merchantId)
                .summaryDate(summaryDate)
                .orderCount(orders.size())
                .successfulOrders(successful)
                .failedOrders(orders.size() - successful)
                .totalIncome(totalIncome)
                .platformFee(platformFee)
                .netIncome(netIncome)
                .refundAmount(refundAmount)
                .couponDeduction(couponDeduction)
                .settlementAmount(netIncome - refundAmount)
                .paymentMethodBreakdown(breakdown)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static boolean isSuccessful(OrderStatus status) {
        return status == OrderStatus.VERIFIED || status == OrderStatus.COMPLETED;
    }

    /**
     * 재실행 시 기존 행을 새 계산값으로 갱신 (키와 생성 시각은 유지)
     */
    public void refreshFrom(FinanceDailySummary recalculated) {
        if (!merchantId.equals(recalculated.merchantId) || !summaryDate.equals(recalculated.summaryDate)) {
            throw new IllegalArgumentException("다른 가맹점/영업일의 요약으로 갱신할 수 없습니다");
        }
        this.orderCount = recalculated.orderCount;
        this.successfulOrders = recalculated.successfulOrders;
        this.failedOrders = recalculated.failedOrders;
        this.totalIncome = recalculated.totalIncome;
        this.platformFee = recalculated.platformFee;
        this.netIncome = recalculated.netIncome;
        this.refundAmount = recalculated.refundAmount;
        this.couponDeduction = recalculated.couponDeduction;
        this.settlementAmount = recalculated.settlementAmount;
        this.paymentMethodBreakdown = new TreeMap<>(recalculated.paymentMethodBreakdown);
        this.updatedAt = recalculated.updatedAt;
    }

    public void assignId(Long summaryId) {
        this.summaryId = summaryId;
    }
}
