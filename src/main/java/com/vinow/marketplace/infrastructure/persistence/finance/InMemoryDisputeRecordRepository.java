package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.DisputeRecord;
import com.vinow.marketplace.domain.finance.DisputeRecordRepository;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
@InMemoryDatastore
public class InMemoryDisputeRecordRepository implements DisputeRecordRepository {

    private final CopyOnWriteArrayList<DisputeRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public DisputeRecord save(DisputeRecord record) {
        record.assignId(idSequence.incrementAndGet());
        records.add(record);
        return record;
    }

    @Override
    public List<DisputeRecord> findByReconciliationId(Long reconciliationId) {
        return records.stream()
                .filter(record -> record.getReconciliationId().equals(reconciliationId))
                .collect(Collectors.toList());
    }
}
