package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.ReconciliationLog;
import com.vinow.marketplace.domain.finance.ReconciliationLogRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
@InMemoryDatastore
public class InMemoryReconciliationLogRepository implements ReconciliationLogRepository {

    private final ConcurrentHashMap<Long, ReconciliationLog> logs = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public synchronized ReconciliationLog save(ReconciliationLog log) {
        if (log.getReconciliationId() == null) {
            findByMerchantIdAndBusinessDate(log.getMerchantId(), log.getBusinessDate())
                    .ifPresent(existing -> {
                        throw new IllegalStateException("대사 기록 중복 - reconciliationId="
                                + existing.getReconciliationId());
                    });
            log.assignId(idSequence.incrementAndGet());
        }
        logs.put(log.getReconciliationId(), log);
        return log;
    }

    @Override
    public Optional<ReconciliationLog> findById(Long reconciliationId) {
        return Optional.ofNullable(logs.get(reconciliationId));
    }

    @Override
    public Optional<ReconciliationLog> findByMerchantIdAndBusinessDate(Long merchantId, LocalDate businessDate) {
        return logs.values().stream()
                .filter(log -> log.getMerchantId().equals(merchantId) && log.getBusinessDate().equals(businessDate))
                .findFirst();
    }

    @Override
    public List<ReconciliationLog> findByMerchantId(Long merchantId, int page, int size) {
        return logs.values().stream()
                .filter(log -> log.getMerchantId().equals(merchantId))
                .sorted(Comparator.comparing(ReconciliationLog::getBusinessDate).reversed())
                .skip((long) page * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    public int count() {
        return logs.size();
    }
}
