package com.vinow.marketplace.domain.finance;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ReconciliationLogRepository {

    ReconciliationLog save(ReconciliationLog log);

    Optional<ReconciliationLog> findById(Long reconciliationId);

    Optional<ReconciliationLog> findByMerchantIdAndBusinessDate(Long merchantId, LocalDate businessDate);

    /**
     * 가맹점 대사 목록, 영업일 최신순
     */
    List<ReconciliationLog> findByMerchantId(Long merchantId, int page, int size);
}
