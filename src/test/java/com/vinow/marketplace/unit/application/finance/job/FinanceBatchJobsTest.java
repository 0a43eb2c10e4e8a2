package com.vinow.marketplace.unit.application.finance.job;

import com.vinow.marketplace.application.finance.DailySummaryService;
import com.vinow.marketplace.application.finance.ReconciliationService;
import com.vinow.marketplace.application.finance.ReportCleanupService;
import com.vinow.marketplace.application.finance.SettlementService;
import com.vinow.marketplace.application.finance.job.BatchJobExecutor;
import com.vinow.marketplace.application.finance.job.FinanceBatchJobs;
import com.vinow.marketplace.application.finance.job.JobRunSummary;
import com.vinow.marketplace.application.finance.job.TaskStatus;
import com.vinow.marketplace.common.exception.ExternalIOException;
import com.vinow.marketplace.config.TestDataFactory;
import com.vinow.marketplace.domain.finance.FinanceDailySummary;
import com.vinow.marketplace.domain.finance.ReconciliationLog;
import com.vinow.marketplace.domain.finance.ReportExport;
import com.vinow.marketplace.domain.merchant.MerchantStatus;
import com.vinow.marketplace.infrastructure.persistence.merchant.InMemoryMerchantRepository;
import com.vinow.marketplace.unit.BaseUnitTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * FinanceBatchJobs 테스트
 *
 * 서비스는 Mock, 가맹점 목록은 인메모리 저장소, 실행기는 실제 스레드 풀을 사용한다.
 */
@DisplayName("FinanceBatchJobs 테스트")
class FinanceBatchJobsTest extends BaseUnitTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 14);

    @Mock
    private DailySummaryService dailySummaryService;

    @Mock
    private SettlementService settlementService;

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private ReportCleanupService reportCleanupService;

    private BatchJobExecutor batchJobExecutor;
    private FinanceBatchJobs financeBatchJobs;

    @BeforeEach
    void setUp() {
        InMemoryMerchantRepository merchantRepository = new InMemoryMerchantRepository();
        merchantRepository.save(TestDataFactory.merchant(1L, MerchantStatus.ACTIVE));
        merchantRepository.save(TestDataFactory.merchant(2L, MerchantStatus.ACTIVE));
        merchantRepository.save(TestDataFactory.merchant(3L, MerchantStatus.ACTIVE));
        merchantRepository.save(TestDataFactory.merchant(4L, MerchantStatus.SUSPENDED));

        batchJobExecutor = new BatchJobExecutor(2, Duration.ofSeconds(5), Clock.systemDefaultZone());
        financeBatchJobs = new FinanceBatchJobs(batchJobExecutor, merchantRepository, dailySummaryService,
                settlementService, reconciliationService, reportCleanupService);
    }

    @AfterEach
    void tearDown() {
        batchJobExecutor.shutdown();
    }

    @Test
    @DisplayName("일별 집계 - 활성 가맹점만, 한 가맹점 실패가 다른 가맹점에 영향 없음")
    void testRunDailySummaryJob_FailureIsolated() {
        // Given
        FinanceDailySummary generated = mock(FinanceDailySummary.class);
        when(dailySummaryService.generateDailySummary(1L, DATE)).thenReturn(Optional.of(generated));
        when(dailySummaryService.generateDailySummary(2L, DATE)).thenThrow(new IllegalStateException("집계 실패"));
        when(dailySummaryService.generateDailySummary(3L, DATE)).thenReturn(Optional.empty());

        // When
        JobRunSummary summary = financeBatchJobs.runDailySummaryJob(DATE);

        // Then
        assertEquals(FinanceBatchJobs.DAILY_SUMMARY_JOB, summary.getJobName());
        assertEquals(1, summary.getSuccessCount());
        assertEquals(1, summary.getSkippedCount());
        assertEquals(1, summary.getErrorCount());
        assertEquals(List.of("2"), summary.getFailedTargets());
        verify(dailySummaryService, never()).generateDailySummary(eq(4L), any());
    }

    @Test
    @DisplayName("주간 정산 - 기간 전달, 정산 없음은 건너뜀")
    void testRunSettlementJob() {
        // Given
        LocalDate start = LocalDate.of(2025, 1, 6);
        LocalDate end = LocalDate.of(2025, 1, 12);
        when(settlementService.generateSettlement(anyLong(), eq(start), eq(end))).thenReturn(Optional.empty());

        // When
        JobRunSummary summary = financeBatchJobs.runSettlementJob(start, end);

        // Then
        assertEquals(3, summary.getSkippedCount());
        assertEquals(0, summary.getErrorCount());
        verify(settlementService, times(3)).generateSettlement(anyLong(), eq(start), eq(end));
    }

    @Test
    @DisplayName("대사 - force 플래그 전달")
    void testRunReconciliationJob() {
        // Given
        ReconciliationLog reconciled = mock(ReconciliationLog.class);
        when(reconciliationService.reconcile(anyLong(), eq(DATE), eq(true))).thenReturn(Optional.of(reconciled));

        // When
        JobRunSummary summary = financeBatchJobs.runReconciliationJob(DATE, true);

        // Then
        assertEquals(3, summary.getSuccessCount());
        verify(reconciliationService, never()).reconcile(anyLong(), any(), eq(false));
    }

    @Test
    @DisplayName("리포트 정리 - 실패한 내보내기 키 기록")
    void testRunReportCleanupJob() {
        // Given
        LocalDateTime expiredAt = LocalDateTime.of(2025, 1, 1, 0, 0);
        ReportExport ok = export(1L, expiredAt);
        ReportExport broken = export(2L, expiredAt);
        when(reportCleanupService.findExpiredExports()).thenReturn(List.of(ok, broken));
        when(reportCleanupService.cleanup(ok)).thenReturn(TaskStatus.SUCCESS);
        when(reportCleanupService.cleanup(broken))
                .thenThrow(ExternalIOException.file("권한 없음", new IOException("denied")));

        // When
        JobRunSummary summary = financeBatchJobs.runReportCleanupJob();

        // Then
        assertEquals(1, summary.getSuccessCount());
        assertEquals(List.of("export-2"), summary.getFailedTargets());
    }

    private ReportExport export(Long exportId, LocalDateTime expiresAt) {
        ReportExport export = ReportExport.builder()
                .merchantId(TestDataFactory.MERCHANT_ID)
                .reportType("DAILY")
                .fileUrl("https://cdn.vinow.vn/reports/" + exportId + ".csv")
                .expiresAt(expiresAt)
                .createdAt(expiresAt.minusDays(7))
                .build();
        export.assignId(exportId);
        return export;
    }
}
