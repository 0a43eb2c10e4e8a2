package com.vinow.marketplace.application.finance.job;

import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * BatchJobExecutor - 대상별 fan-out 실행기
 *
 * 실행 순서:
 * 1. 대상 목록 조회 (실패 시 실행 전체 중단, 예외 전파)
 * 2. 대상마다 작업 1개를 고정 크기 풀에 제출
 * 3. 작업이 시작된 시점부터 taskTimeout이 지나면 FAILED로 기록하고 작업 스레드를 인터럽트
 * 4. 실행 마감(taskTimeout × (대기열 회차 + 1)) 안에 끝나지 않은 대상은 FAILED로 기록하고 작업 취소
 * 5. 작업별 결과(SUCCESS / SKIPPED / FAILED)를 JobRunSummary로 집계
 *
 * 한 대상의 예외(Error 포함)나 시간 초과는 해당 대상의 FAILED로만 기록되고 다른 대상에 영향을 주지 않는다.
 * 인터럽트를 무시하는 작업이 스레드를 점유해도 실행 마감이 지나면 run()은 반환된다.
 */
@Slf4j
@Component
public class BatchJobExecutor {

    private final ExecutorService workerPool;
    private final ScheduledExecutorService timeoutWatchdog;
    private final int poolSize;
    private final Duration taskTimeout;
    private final Clock clock;

    @Autowired
    public BatchJobExecutor(MarketplaceProperties properties, Clock clock) {
        this(properties.getBatch().getPoolSize(), properties.getBatch().getMerchantTimeout(), clock);
    }

    public BatchJobExecutor(int poolSize, Duration taskTimeout, Clock clock) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize는 1 이상이어야 합니다: " + poolSize);
        }
        this.poolSize = poolSize;
        this.workerPool = Executors.newFixedThreadPool(poolSize, namedThreadFactory("finance-batch-"));
        this.timeoutWatchdog = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("finance-batch-watchdog-"));
        this.taskTimeout = taskTimeout;
        this.clock = clock;
    }

    public <K> JobRunSummary run(String jobName, Supplier<List<K>> targetSupplier, Function<K, TaskStatus> task) {
        return run(jobName, targetSupplier, Objects::toString, task);
    }

    /**
     * @param targetKeyMapper 로그와 실패 목록에 남길 대상 식별자
     */
    public <K> JobRunSummary run(String jobName, Supplier<List<K>> targetSupplier,
                                 Function<K, String> targetKeyMapper, Function<K, TaskStatus> task) {
        LocalDateTime startedAt = LocalDateTime.now(clock);

        // STEP 1: 대상 조회
        List<K> targets;
        try {
            targets = targetSupplier.get();
        } catch (RuntimeException e) {
            log.error("[BatchJobExecutor] 대상 조회 실패, 실행 중단 - job={}", jobName, e);
            throw e;
        }
        log.info("[BatchJobExecutor] 배치 시작 - job={}, targets={}", jobName, targets.size());

        // STEP 2: fan-out
        List<String> targetKeys = new ArrayList<>(targets.size());
        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>(targets.size());
        for (K target : targets) {
            String targetKey = targetKeyMapper.apply(target);
            targetKeys.add(targetKey);
            futures.add(submit(targetKey, target, task));
        }

        // STEP 3: 결과 수집 (실행 마감까지만 대기)
        long deadlineNanos = System.nanoTime() + runDeadline(targets.size()).toNanos();
        List<TaskOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(jobName, targetKeys.get(i), futures.get(i), deadlineNanos));
        }

        // STEP 4: 집계
        JobRunSummary summary = JobRunSummary.reduce(jobName, outcomes, startedAt, LocalDateTime.now(clock));
        log.info("[BatchJobExecutor] 배치 종료 - job={}, success={}, skipped={}, error={}, elapsed={}ms",
                jobName, summary.getSuccessCount(), summary.getSkippedCount(), summary.getErrorCount(),
                summary.getElapsed().toMillis());
        return summary;
    }

    private <K> CompletableFuture<TaskOutcome> submit(String targetKey, K target, Function<K, TaskStatus> task) {
        CompletableFuture<TaskOutcome> result = new CompletableFuture<>();

        Future<?> submitted = workerPool.submit(() -> {
            ScheduledFuture<?> watchdog = timeoutWatchdog.schedule(
                    () -> result.completeExceptionally(new TimeoutException("처리 시간 초과 " + taskTimeout.toMillis() + "ms")),
                    taskTimeout.toMillis(), TimeUnit.MILLISECONDS);

            try {
                TaskStatus status = task.apply(target);
                result.complete(TaskOutcome.of(targetKey, status == null ? TaskStatus.SUCCESS : status));
            } catch (Throwable e) {
                result.completeExceptionally(e);
            } finally {
                watchdog.cancel(false);
            }
        });

        // 시간 초과로 끝난 대상은 실행 중이면 인터럽트, 대기 중이면 대기열에서 제거
        result.whenComplete((outcome, error) -> {
            if (error instanceof TimeoutException) {
                submitted.cancel(true);
            }
        });
        return result;
    }

    private TaskOutcome await(String jobName, String targetKey, CompletableFuture<TaskOutcome> future,
                              long deadlineNanos) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            TimeoutException expired = new TimeoutException("실행 마감 초과");
            if (future.completeExceptionally(expired)) {
                log.error("[BatchJobExecutor] 실행 마감 초과 - job={}, target={}", jobName, targetKey);
                return TaskOutcome.failed(targetKey, expired.getMessage());
            }
            return await(jobName, targetKey, future, deadlineNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(new TimeoutException("결과 대기 중 인터럽트"));
            log.error("[BatchJobExecutor] 결과 대기 중 인터럽트 - job={}, target={}", jobName, targetKey);
            return TaskOutcome.failed(targetKey, "결과 대기 중 인터럽트");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.error("[BatchJobExecutor] 처리 시간 초과 - job={}, target={}, timeout={}ms",
                        jobName, targetKey, taskTimeout.toMillis());
            } else {
                log.error("[BatchJobExecutor] 대상 처리 실패 - job={}, target={}", jobName, targetKey, cause);
            }
            return TaskOutcome.failed(targetKey, cause.getMessage());
        }
    }

    /**
     * 모든 작업이 제한 시간을 지키면 걸리는 최대 시간에 한 회차 여유를 더한 값
     */
    private Duration runDeadline(int targetCount) {
        long waves = (targetCount + poolSize - 1) / poolSize;
        return taskTimeout.multipliedBy(waves + 1);
    }

    @PreDestroy
    public void shutdown() {
        workerPool.shutdownNow();
        timeoutWatchdog.shutdownNow();
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
