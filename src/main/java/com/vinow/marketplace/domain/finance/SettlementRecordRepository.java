package com.vinow.marketplace.domain.finance;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SettlementRecordRepository {

    SettlementRecord save(SettlementRecord record);

    Optional<SettlementRecord> findById(Long settlementId);

    Optional<SettlementRecord> findByMerchantIdAndPeriod(Long merchantId, LocalDate periodStart, LocalDate periodEnd);

    /**
     * 가맹점 정산 목록, 기간 최신순
     */
    List<SettlementRecord> findByMerchantId(Long merchantId, int page, int size);
}
