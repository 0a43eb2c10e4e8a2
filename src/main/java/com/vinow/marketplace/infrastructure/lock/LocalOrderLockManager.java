package com.vinow.marketplace.infrastructure.lock;

import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단일 프로세스용 주문 락 (주문별 ReentrantLock)
 *
 * 락을 기다리거나 보유한 스레드 수(holders)를 함께 관리하고,
 * 마지막 스레드가 빠져나갈 때 맵에서 제거한다.
 */
@Component
@ConditionalOnProperty(prefix = "marketplace.lock", name = "type", havingValue = "LOCAL", matchIfMissing = true)
public class LocalOrderLockManager extends AbstractOrderLockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    @Autowired
    public LocalOrderLockManager(MarketplaceProperties properties) {
        this(properties.getLock().getWaitTime());
    }

    public LocalOrderLockManager(Duration waitTime) {
        super(waitTime);
    }

    @Override
    protected boolean tryAcquire(String lockKey) throws InterruptedException {
        LockEntry entry = locks.compute(lockKey, (key, existing) -> {
            LockEntry target = existing == null ? new LockEntry() : existing;
            target.holders++;
            return target;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(waitTime.toMillis(), TimeUnit.MILLISECONDS);
            return acquired;
        } finally {
            if (!acquired) {
                leave(lockKey);
            }
        }
    }

    @Override
    protected void release(String lockKey) {
        LockEntry entry = locks.get(lockKey);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            return;
        }
        entry.lock.unlock();
        leave(lockKey);
    }

    int activeLockCount() {
        return locks.size();
    }

    private void leave(String lockKey) {
        locks.computeIfPresent(lockKey, (key, entry) -> --entry.holders == 0 ? null : entry);
    }

    private static class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int holders;
    }
}
