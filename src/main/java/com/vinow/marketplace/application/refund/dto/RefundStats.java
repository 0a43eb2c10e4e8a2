package com.vinow.marketplace.application.refund.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * 가맹점 환불 통계 (최근 periodDays일)
 */
@Getter
@Builder
public class RefundStats {
    private int periodDays;
    private long pendingCount;
    private long refundedCount;
    private long refundedAmount;
    private Map<String, Long> reasonCounts;
}
