package com.vinow.marketplace.domain.finance;

import java.util.List;

public interface DisputeRecordRepository {

    DisputeRecord save(DisputeRecord record);

    List<DisputeRecord> findByReconciliationId(Long reconciliationId);
}
