package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.ReconciliationLog;
import com.vinow.marketplace.domain.finance.ReconciliationLogRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@JpaDatastore
public class MySQLReconciliationLogRepository implements ReconciliationLogRepository {

    private final ReconciliationLogJpaRepository reconciliationLogJpaRepository;

    public MySQLReconciliationLogRepository(ReconciliationLogJpaRepository reconciliationLogJpaRepository) {
        this.reconciliationLogJpaRepository = reconciliationLogJpaRepository;
    }

    @Override
    public ReconciliationLog save(ReconciliationLog log) {
        return reconciliationLogJpaRepository.save(log);
    }

    @Override
    public Optional<ReconciliationLog> findById(Long reconciliationId) {
        return reconciliationLogJpaRepository.findById(reconciliationId);
    }

    @Override
    public Optional<ReconciliationLog> findByMerchantIdAndBusinessDate(Long merchantId, LocalDate businessDate) {
        return reconciliationLogJpaRepository.findByMerchantIdAndBusinessDate(merchantId, businessDate);
    }

    @Override
    public List<ReconciliationLog> findByMerchantId(Long merchantId, int page, int size) {
        return reconciliationLogJpaRepository.findByMerchantIdOrderByBusinessDateDesc(merchantId,
                PageRequest.of(page, size));
    }
}
