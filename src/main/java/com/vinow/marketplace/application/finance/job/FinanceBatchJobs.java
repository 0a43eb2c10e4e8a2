package com.vinow.marketplace.application.finance.job;

import com.vinow.marketplace.application.finance.DailySummaryService;
import com.vinow.marketplace.application.finance.ReconciliationService;
import com.vinow.marketplace.application.finance.ReportCleanupService;
import com.vinow.marketplace.application.finance.SettlementService;
import com.vinow.marketplace.domain.merchant.MerchantRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * 재무 배치 작업 모음
 *
 * 가맹점 단위 작업은 활성 가맹점 목록을 대상으로 BatchJobExecutor에서 병렬 실행한다.
 * 결과가 없는 대상(매출 없음, 이미 정산됨 아님)은 SKIPPED로 집계된다.
 */
@Component
public class FinanceBatchJobs {

    public static final String DAILY_SUMMARY_JOB = "daily-summary";
    public static final String SETTLEMENT_JOB = "settlement";
    public static final String RECONCILIATION_JOB = "reconciliation";
    public static final String REPORT_CLEANUP_JOB = "report-cleanup";

    private final BatchJobExecutor batchJobExecutor;
    private final MerchantRepository merchantRepository;
    private final DailySummaryService dailySummaryService;
    private final SettlementService settlementService;
    private final ReconciliationService reconciliationService;
    private final ReportCleanupService reportCleanupService;

    public FinanceBatchJobs(BatchJobExecutor batchJobExecutor,
                            MerchantRepository merchantRepository,
                            DailySummaryService dailySummaryService,
                            SettlementService settlementService,
                            ReconciliationService reconciliationService,
                            ReportCleanupService reportCleanupService) {
        this.batchJobExecutor = batchJobExecutor;
        this.merchantRepository = merchantRepository;
        this.dailySummaryService = dailySummaryService;
        this.settlementService = settlementService;
        this.reconciliationService = reconciliationService;
        this.reportCleanupService = reportCleanupService;
    }

    public JobRunSummary runDailySummaryJob(LocalDate summaryDate) {
        return batchJobExecutor.run(DAILY_SUMMARY_JOB,
                merchantRepository::findActiveMerchantIds,
                merchantId -> dailySummaryService.generateDailySummary(merchantId, summaryDate).isPresent()
                        ? TaskStatus.SUCCESS : TaskStatus.SKIPPED);
    }

    public JobRunSummary runSettlementJob(LocalDate periodStart, LocalDate periodEnd) {
        return batchJobExecutor.run(SETTLEMENT_JOB,
                merchantRepository::findActiveMerchantIds,
                merchantId -> settlementService.generateSettlement(merchantId, periodStart, periodEnd).isPresent()
                        ? TaskStatus.SUCCESS : TaskStatus.SKIPPED);
    }

    public JobRunSummary runReconciliationJob(LocalDate businessDate, boolean force) {
        return batchJobExecutor.run(RECONCILIATION_JOB,
                merchantRepository::findActiveMerchantIds,
                merchantId -> reconciliationService.reconcile(merchantId, businessDate, force).isPresent()
                        ? TaskStatus.SUCCESS : TaskStatus.SKIPPED);
    }

    public JobRunSummary runReportCleanupJob() {
        return batchJobExecutor.run(REPORT_CLEANUP_JOB,
                reportCleanupService::findExpiredExports,
                export -> "export-" + export.getExportId(),
                reportCleanupService::cleanup);
    }
}
