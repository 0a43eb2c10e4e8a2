package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.ReconciliationLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ReconciliationLogJpaRepository extends JpaRepository<ReconciliationLog, Long> {

    Optional<ReconciliationLog> findByMerchantIdAndBusinessDate(Long merchantId, LocalDate businessDate);

    List<ReconciliationLog> findByMerchantIdOrderByBusinessDateDesc(Long merchantId, Pageable pageable);
}
