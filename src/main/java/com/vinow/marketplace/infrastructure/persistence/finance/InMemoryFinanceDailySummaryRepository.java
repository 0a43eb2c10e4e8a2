package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.FinanceDailySummaryRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * (merchantId, summaryDate) 키로 저장하여 유니크 제약을 흉내낸다.
 */
@Repository
@InMemoryDatastore
public class InMemoryFinanceDailySummaryRepository implements FinanceDailySummaryRepository {

    private final ConcurrentHashMap<String, FinanceDailySummary> summaries = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public FinanceDailySummary save(FinanceDailySummary summary) {
        String key = key(summary.getMerchantId(), summary.getSummaryDate());
        // 확인과 저장을 키 단위로 원자적으로 수행 (동시 최초 저장 중 하나만 성공)
        summaries.compute(key, (ignored, existing) -> {
            if (existing != null && !Objects.equals(existing.getSummaryId(), summary.getSummaryId())) {
                throw new IllegalStateException("일별 요약 중복 - key=" + key);
            }
            if (summary.getSummaryId() == null) {
                summary.assignId(idSequence.incrementAndGet());
            }
            return summary;
        });
        return summary;
    }

    @Override
    public Optional<FinanceDailySummary> findByMerchantIdAndSummaryDate(Long merchantId, LocalDate summaryDate) {
        return Optional.ofNullable(summaries.get(key(merchantId, summaryDate)));
    }

    @Override
    public List<FinanceDailySummary> findByMerchantIdAndSummaryDateBetween(Long merchantId, LocalDate startDate,
                                                                           LocalDate endDate) {
        return summaries.values().stream()
                .filter(summary -> summary.getMerchantId().equals(merchantId))
                .filter(summary -> !summary.getSummaryDate().isBefore(startDate)
                        && !summary.getSummaryDate().isAfter(endDate))
                .sorted(Comparator.comparing(FinanceDailySummary::getSummaryDate))
                .collect(Collectors.toList());
    }

    public int count() {
        return summaries.size();
    }

    private static String key(Long merchantId, LocalDate date) {
        return merchantId + "_" + date;
    }
}
