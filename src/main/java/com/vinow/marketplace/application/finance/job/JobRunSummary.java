package com.vinow.marketplace.application.finance.job;

import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 배치 실행 1회의 집계 결과 (관측용)
 */
@Getter
public class JobRunSummary {

    private final String jobName;
    private final int successCount;
    private final int skippedCount;
    private final int errorCount;
    private final List<String> failedTargets;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;

    private JobRunSummary(String jobName, int successCount, int skippedCount, int errorCount,
                          List<String> failedTargets, LocalDateTime startedAt, LocalDateTime finishedAt) {
        this.jobName = jobName;
        this.successCount = successCount;
        this.skippedCount = skippedCount;
        this.errorCount = errorCount;
        this.failedTargets = failedTargets;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public static JobRunSummary reduce(String jobName, List<TaskOutcome> outcomes,
                                       LocalDateTime startedAt, LocalDateTime finishedAt) {
        int success = 0;
        int skipped = 0;
        int error = 0;
        for (TaskOutcome outcome : outcomes) {
            switch (outcome.getStatus()) {
                case SUCCESS -> success++;
                case SKIPPED -> skipped++;
                case FAILED -> error++;
            }
        }
        List<String> failedTargets = outcomes.stream()
                .filter(outcome -> outcome.getStatus() == TaskStatus.FAILED)
                .map(TaskOutcome::getTargetKey)
                .collect(Collectors.toList());
        return new JobRunSummary(jobName, success, skipped, error, List.copyOf(failedTargets), startedAt, finishedAt);
    }

    public int getTotalCount() {
        return successCount + skippedCount + errorCount;
    }

    public Duration getElapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
