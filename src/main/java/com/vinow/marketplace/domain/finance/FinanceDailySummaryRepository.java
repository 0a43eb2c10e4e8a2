package com.vinow.marketplace.domain.finance;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FinanceDailySummaryRepository {

    FinanceDailySummary save(FinanceDailySummary summary);

    Optional<FinanceDailySummary> findByMerchantIdAndSummaryDate(Long merchantId, LocalDate summaryDate);

    /**
     * 기간 내 요약 [startDate, endDate] (양 끝 포함), 날짜 오름차순
     */
    List<FinanceDailySummary> findByMerchantIdAndSummaryDateBetween(Long merchantId, LocalDate startDate, LocalDate endDate);
}
