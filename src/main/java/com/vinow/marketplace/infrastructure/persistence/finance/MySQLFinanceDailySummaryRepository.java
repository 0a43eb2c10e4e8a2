package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.FinanceDailySummaryRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@JpaDatastore
public class MySQLFinanceDailySummaryRepository implements FinanceDailySummaryRepository {

    private final FinanceDailySummaryJpaRepository financeDailySummaryJpaRepository;

    public MySQLFinanceDailySummaryRepository(FinanceDailySummaryJpaRepository financeDailySummaryJpaRepository) {
        this.financeDailySummaryJpaRepository = financeDailySummaryJpaRepository;
    }

    @Override
    public FinanceDailySummary save(FinanceDailySummary summary) {
        return financeDailySummaryJpaRepository.save(summary);
    }

    @Override
    public Optional<FinanceDailySummary> findByMerchantIdAndSummaryDate(Long merchantId, LocalDate summaryDate) {
        return financeDailySummaryJpaRepository.findByMerchantIdAndSummaryDate(merchantId, summaryDate);
    }

    @Override
    public List<FinanceDailySummary> findByMerchantIdAndSummaryDateBetween(Long merchantId, LocalDate startDate,
                                                                           LocalDate endDate) {
        return financeDailySummaryJpaRepository
                .findByMerchantIdAndSummaryDateBetweenOrderBySummaryDateAsc(merchantId, startDate, endDate);
    }
}
