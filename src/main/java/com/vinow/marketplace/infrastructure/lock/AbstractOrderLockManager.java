package com.vinow.marketplace.infrastructure.lock;

import com.vinow.marketplace.common.exception.ConcurrencyConflictException;
import com.vinow.marketplace.common.exception.ErrorCode;
import com.vinow.marketplace.common.exception.SystemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 락 획득/해제 순서를 공통화한 템플릿
 *
 * 실행 순서:
 * 1. 락 획득 (waitTime 초과 시 ConcurrencyConflictException)
 * 2. 호출자에 트랜잭션이 있으면 afterCompletion 콜백에서 해제
 *    → 커밋이 끝난 뒤에만 다음 요청이 같은 주문을 읽는다
 * 3. 트랜잭션이 없으면 finally에서 해제
 */
@Slf4j
public abstract class AbstractOrderLockManager implements OrderLockManager {

    protected final Duration waitTime;

    protected AbstractOrderLockManager(Duration waitTime) {
        this.waitTime = waitTime;
    }

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> task) {
        boolean acquired;
        try {
            acquired = tryAcquire(lockKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "락 대기 중 인터럽트 - key=" + lockKey, e);
        }

        if (!acquired) {
            log.warn("[OrderLock] 락 획득 실패 - key={}, waitTime={}ms", lockKey, waitTime.toMillis());
            throw new ConcurrencyConflictException("주문 락 대기 시간 초과 - key=" + lockKey);
        }
        log.debug("[OrderLock] 락 획득 - key={}", lockKey);

        boolean releaseOnCompletion = TransactionSynchronizationManager.isSynchronizationActive();
        if (releaseOnCompletion) {
            TransactionSynchronizationManager.registerSynchronization(new LockReleaseSynchronization(lockKey));
        }

        try {
            return task.get();
        } finally {
            if (!releaseOnCompletion) {
                releaseQuietly(lockKey);
            }
        }
    }

    protected abstract boolean tryAcquire(String lockKey) throws InterruptedException;

    protected abstract void release(String lockKey);

    private void releaseQuietly(String lockKey) {
        try {
            release(lockKey);
            log.debug("[OrderLock] 락 해제 - key={}", lockKey);
        } catch (RuntimeException e) {
            // 작업 결과는 이미 확정되었으므로 해제 실패는 기록만 한다 (lease 만료로 회수됨)
            log.error("[OrderLock] 락 해제 중 오류 발생 - key={}", lockKey, e);
        }
    }

    private class LockReleaseSynchronization implements TransactionSynchronization {

        private final String lockKey;

        LockReleaseSynchronization(String lockKey) {
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            releaseQuietly(lockKey);
        }
    }
}
