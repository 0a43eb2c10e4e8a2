package com.vinow.marketplace.infrastructure.persistence.refund;

import com.vinow.marketplace.domain.refund.RefundRecord;
import com.vinow.marketplace.domain.refund.RefundRecordRepository;
import com.vinow.marketplace.domain.refund.RefundStatus;
import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
@InMemoryDatastore
public class InMemoryRefundRecordRepository implements RefundRecordRepository {

    private final ConcurrentHashMap<Long, RefundRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Override
    public RefundRecord save(RefundRecord record) {
        if (record.getRefundRecordId() == null) {
            record.assignId(idSequence.incrementAndGet());
        }
        records.put(record.getRefundRecordId(), record);
        return record;
    }

    @Override
    public Optional<RefundRecord> findOpenByOrderId(Long orderId) {
        return records.values().stream()
                .filter(record -> record.getOrderId().equals(orderId))
                .filter(record -> record.getStatus() == RefundStatus.REQUESTED)
                .max(Comparator.comparing(RefundRecord::getRefundRecordId));
    }

    @Override
    public List<RefundRecord> findByOrderId(Long orderId) {
        return records.values().stream()
                .filter(record -> record.getOrderId().equals(orderId))
                .sorted(Comparator.comparing(RefundRecord::getRefundRecordId))
                .collect(Collectors.toList());
    }
}
