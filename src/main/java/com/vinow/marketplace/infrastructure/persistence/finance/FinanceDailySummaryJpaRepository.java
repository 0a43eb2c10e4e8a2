package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FinanceDailySummaryJpaRepository extends JpaRepository<FinanceDailySummary, Long> {

    Optional<FinanceDailySummary> findByMerchantIdAndSummaryDate(Long merchantId, LocalDate summaryDate);

    List<FinanceDailySummary> findByMerchantIdAndSummaryDateBetweenOrderBySummaryDateAsc(Long merchantId,
                                                                                        LocalDate startDate,
                                                                                        LocalDate endDate);
}
