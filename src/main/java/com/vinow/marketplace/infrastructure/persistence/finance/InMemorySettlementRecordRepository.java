package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.SettlementRecord;
import com.vinow.marketplace.domain.finance.SettlementRecordRepository;
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
public class InMemorySettlementRecordRepository implements SettlementRecordRepository {

    private final ConcurrentHashMap<Long, SettlementRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public synchronized SettlementRecord save(SettlementRecord record) {
        if (record.getSettlementId() == null) {
            findByMerchantIdAndPeriod(record.getMerchantId(), record.getPeriodStart(), record.getPeriodEnd())
                    .ifPresent(existing -> {
                        throw new IllegalStateException("정산 기간 중복 - settlementNo=" + existing.getSettlementNo());
                    });
            record.assignId(idSequence.incrementAndGet());
        }
        records.put(record.getSettlementId(), record);
        return record;
    }

    @Override
    public Optional<SettlementRecord> findById(Long settlementId) {
        return Optional.ofNullable(records.get(settlementId));
    }

    @Override
    public Optional<SettlementRecord> findByMerchantIdAndPeriod(Long merchantId, LocalDate periodStart,
                                                                LocalDate periodEnd) {
        return records.values().stream()
                .filter(record -> record.getMerchantId().equals(merchantId)
                        && record.getPeriodStart().equals(periodStart)
                        && record.getPeriodEnd().equals(periodEnd))
                .findFirst();
    }

    @Override
    public List<SettlementRecord> findByMerchantId(Long merchantId, int page, int size) {
        return records.values().stream()
                .filter(record -> record.getMerchantId().equals(merchantId))
                .sorted(Comparator.comparing(SettlementRecord::getPeriodStart).reversed())
                .skip((long) page * size)
                .limit(size)
                .collect(Collectors.toList());
    }

    public int count() {
        return records.size();
    }
}
