package com.vinow.marketplace.infrastructure.persistence.finance;

import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.domain.finance.ReportExport;
import com.vinow.marketplace.domain.finance.ReportExportRepository;
import com.vinow.marketplace.infrastructure.persistence.JpaDatastore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
@JpaDatastore
public class MySQLReportExportRepository implements ReportExportRepository {

    private final ReportExportJpaRepository reportExportJpaRepository;

    public MySQLReportExportRepository(ReportExportJpaRepository reportExportJpaRepository) {
        this.reportExportJpaRepository = reportExportJpaRepository;
    }

    @Override
    public ReportExport save(ReportExport export) {
        return reportExportJpaRepository.save(export);
    }

    @Override
    public List<ReportExport> findExpired(LocalDateTime now) {
        try {
            return reportExportJpaRepository.findByExpiresAtBeforeOrderByExportIdAsc(now);
        } catch (DataAccessException e) {
            throw ExternalIOException.datastore("만료 리포트 조회 실패", e);
        }
    }

    @Override
    public void deleteById(Long exportId) {
        try {
            reportExportJpaRepository.deleteById(exportId);
        } catch (DataAccessException e) {
            throw ExternalIOException.datastore("리포트 행 삭제 실패 - exportId=" + exportId, e);
        }
    }
}
