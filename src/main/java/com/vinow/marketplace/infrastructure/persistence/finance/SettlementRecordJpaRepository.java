package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.SettlementRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SettlementRecordJpaRepository extends JpaRepository<SettlementRecord, Long> {

    Optional<SettlementRecord> findByMerchantIdAndPeriodStartAndPeriodEnd(Long merchantId, LocalDate periodStart,
                                                                          LocalDate periodEnd);

    List<SettlementRecord> findByMerchantIdOrderByPeriodStartDesc(Long merchantId, Pageable pageable);
}
