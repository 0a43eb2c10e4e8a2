package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.DisputeRecord;
import com.vinow.marketplace.domain.finance.DisputeRecordRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@JpaDatastore
public class MySQLDisputeRecordRepository implements DisputeRecordRepository {

    private final DisputeRecordJpaRepository disputeRecordJpaRepository;

    public MySQLDisputeRecordRepository(DisputeRecordJpaRepository disputeRecordJpaRepository) {
        this.disputeRecordJpaRepository = disputeRecordJpaRepository;
    }

    @Override
    public DisputeRecord save(DisputeRecord record) {
        return disputeRecordJpaRepository.save(record);
    }

    @Override
    public List<DisputeRecord> findByReconciliationId(Long reconciliationId) {
        return disputeRecordJpaRepository.findByReconciliationIdOrderByDisputeIdAsc(reconciliationId);
    }
}
