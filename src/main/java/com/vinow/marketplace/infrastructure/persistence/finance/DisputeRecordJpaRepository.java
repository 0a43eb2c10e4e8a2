package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.DisputeRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DisputeRecordJpaRepository extends JpaRepository<DisputeRecord, Long> {

    List<DisputeRecord> findByReconciliationIdOrderByDisputeIdAsc(Long reconciliationId);
}
