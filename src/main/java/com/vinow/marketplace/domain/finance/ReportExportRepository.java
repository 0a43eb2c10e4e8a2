package com.vinow.marketplace.domain.finance;

import java.time.LocalDateTime;
import java.util.List;

public interface ReportExportRepository {

    ReportExport save(ReportExport export);

    /**
     * expiresAt < now 인 내보내기 행
     */
    List<ReportExport> findExpired(LocalDateTime now);

    void deleteById(Long exportId);
}
