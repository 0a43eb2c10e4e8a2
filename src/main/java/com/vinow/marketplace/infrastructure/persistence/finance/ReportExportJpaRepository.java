package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.domain.finance.ReportExport;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface ReportExportJpaRepository extends JpaRepository<ReportExport, Long> {

    List<ReportExport> findByExpiresAtBeforeOrderByExportIdAsc(LocalDateTime now);
}
