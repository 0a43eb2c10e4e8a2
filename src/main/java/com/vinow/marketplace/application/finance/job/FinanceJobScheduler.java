package com.vinow.marketplace.application.finance.job;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * FinanceJobScheduler - 재무 배치 스케줄
 *
 * - 일별 요약: 매일 01:00, 전일 기준
 * - 정산: 매주 월요일 02:00, 지난주 월~일
 * - 대사: 매일 03:00, 전일 기준
 * - 리포트 정리: 매일 04:00
 *
 * 여러 인스턴스가 떠 있어도 ShedLock으로 한 곳에서만 실행된다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "marketplace.batch.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class FinanceJobScheduler {

    private final FinanceBatchJobs financeBatchJobs;
    private final Clock clock;

    public FinanceJobScheduler(FinanceBatchJobs financeBatchJobs, Clock clock) {
        this.financeBatchJobs = financeBatchJobs;
        this.clock = clock;
    }

    @Scheduled(cron = "${marketplace.batch.daily-summary-cron:0 0 1 * * *}",
            zone = "${marketplace.finance.zone:Asia/Ho_Chi_Minh}")
    @SchedulerLock(name = "financeDailySummary", lockAtMostFor = "PT50M", lockAtLeastFor = "PT1M")
    public void dailySummary() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        log.info("[FinanceJobScheduler] 일별 요약 배치 시작 - date={}", yesterday);
        financeBatchJobs.runDailySummaryJob(yesterday);
    }

    @Scheduled(cron = "${marketplace.batch.settlement-cron:0 0 2 * * MON}",
            zone = "${marketplace.finance.zone:Asia/Ho_Chi_Minh}")
    @SchedulerLock(name = "financeSettlement", lockAtMostFor = "PT50M", lockAtLeastFor = "PT1M")
    public void weeklySettlement() {
        LocalDate today = LocalDate.now(clock);
        LocalDate periodStart = today.minusWeeks(1).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate periodEnd = periodStart.plusDays(6);
        log.info("[FinanceJobScheduler] 주간 정산 배치 시작 - period={}~{}", periodStart, periodEnd);
        financeBatchJobs.runSettlementJob(periodStart, periodEnd);
    }

    @Scheduled(cron = "${marketplace.batch.reconciliation-cron:0 0 3 * * *}",
            zone = "${marketplace.finance.zone:Asia/Ho_Chi_Minh}")
    @SchedulerLock(name = "financeReconciliation", lockAtMostFor = "PT50M", lockAtLeastFor = "PT1M")
    public void reconciliation() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        log.info("[FinanceJobScheduler] 대사 배치 시작 - date={}", yesterday);
        financeBatchJobs.runReconciliationJob(yesterday, false);
    }

    @Scheduled(cron = "${marketplace.batch.report-cleanup-cron:0 0 4 * * *}",
            zone = "${marketplace.finance.zone:Asia/Ho_Chi_Minh}")
    @SchedulerLock(name = "financeReportCleanup", lockAtMostFor = "PT30M", lockAtLeastFor = "PT1M")
    public void reportCleanup() {
        log.info("[FinanceJobScheduler] 만료 리포트 정리 배치 시작");
        financeBatchJobs.runReportCleanupJob();
    }
}
