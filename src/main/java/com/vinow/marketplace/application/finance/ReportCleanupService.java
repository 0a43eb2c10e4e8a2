package com.vinow.marketplace.application.finance;

import com.vinow.marketplace.application.finance.job.TaskStatus;
import com.vinow.marketplace.domain.finance.ReportExport;
import com.vinow.marketplace.domain.finance.ReportExportRepository;
import com.vinow.marketplace.infrastructure.file.FileDeletionResult;
import com.vinow.marketplace.infrastructure.file.ReportFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * ReportCleanupService - 만료된 리포트 내보내기 정리
 *
 * 행 단위 처리:
 * 1. 로컬 파일 삭제 (원격 URL은 건드리지 않음, 파일 없음은 성공)
 * 2. 파일 처리가 끝난 경우에만 DB 행 삭제
 *
 * 파일 삭제 실패(권한/I/O) 시 행은 남겨 다음 실행에서 다시 시도한다.
 */
@Slf4j
@Service
public class ReportCleanupService {

    private final ReportExportRepository reportExportRepository;
    private final ReportFileStore reportFileStore;
    private final Clock clock;

    public ReportCleanupService(ReportExportRepository reportExportRepository,
                                ReportFileStore reportFileStore,
                                Clock clock) {
        this.reportExportRepository = reportExportRepository;
        this.reportFileStore = reportFileStore;
        this.clock = clock;
    }

    public List<ReportExport> findExpiredExports() {
        return reportExportRepository.findExpired(LocalDateTime.now(clock));
    }

    /**
     * @throws com.vinow.marketplace.common.exception.ValidationException 파일 참조가 비어 있음
     * @throws com.vinow.marketplace.common.exception.ExternalIOException 파일 또는 행 삭제 실패
     */
    public TaskStatus cleanup(ReportExport export) {
        FileDeletionResult result = reportFileStore.delete(export.fileReference());
        reportExportRepository.deleteById(export.getExportId());

        log.info("[ReportCleanupService] 만료 리포트 정리 - exportId={}, merchantId={}, file={}",
                export.getExportId(), export.getMerchantId(), result);
        return TaskStatus.SUCCESS;
    }
}
