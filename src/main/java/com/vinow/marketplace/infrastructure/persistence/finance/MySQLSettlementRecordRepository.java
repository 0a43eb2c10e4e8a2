package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.SettlementRecord;
import com.vinow.marketplace.domain.finance.SettlementRecordRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@JpaDatastore
public class MySQLSettlementRecordRepository implements SettlementRecordRepository {

    private final SettlementRecordJpaRepository settlementRecordJpaRepository;

    public MySQLSettlementRecordRepository(SettlementRecordJpaRepository settlementRecordJpaRepository) {
        this.settlementRecordJpaRepository = settlementRecordJpaRepository;
    }

    @Override
    public SettlementRecord save(SettlementRecord record) {
        return settlementRecordJpaRepository.saveAndFlush(record);
    }

    @Override
    public Optional<SettlementRecord> findById(Long settlementId) {
        return settlementRecordJpaRepository.findById(settlementId);
    }

    @Override
    public Optional<SettlementRecord> findByMerchantIdAndPeriod(Long merchantId, LocalDate periodStart,
                                                                LocalDate periodEnd) {
        return settlementRecordJpaRepository.findByMerchantIdAndPeriodStartAndPeriodEnd(merchantId, periodStart,
                periodEnd);
    }

    @Override
    public List<SettlementRecord> findByMerchantId(Long merchantId, int page, int size) {
        return settlementRecordJpaRepository.findByMerchantIdOrderByPeriodStartDesc(merchantId,
                PageRequest.of(page, size));
    }
}
