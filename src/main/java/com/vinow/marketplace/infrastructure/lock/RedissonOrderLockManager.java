package com.vinow.marketplace.infrastructure.lock;

import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Redisson RLock 기반 주문 락 (여러 인스턴스 공유)
 *
 * leaseTime이 지나면 Redis가 락을 자동 회수한다.
 */
@Component
@ConditionalOnProperty(prefix = "marketplace.lock", name = "type", havingValue = "REDIS")
public class RedissonOrderLockManager extends AbstractOrderLockManager {

    private final RedissonClient redissonClient;
    private final long leaseTimeMillis;

    public RedissonOrderLockManager(RedissonClient redissonClient, MarketplaceProperties properties) {
        super(properties.getLock().getWaitTime());
        this.redissonClient = redissonClient;
        this.leaseTimeMillis = properties.getLock().getLeaseTime().toMillis();
    }

    @Override
    protected boolean tryAcquire(String lockKey) throws InterruptedException {
        RLock lock = redissonClient.getLock(lockKey);
        return lock.tryLock(waitTime.toMillis(), leaseTimeMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    protected void release(String lockKey) {
        RLock lock = redissonClient.getLock(lockKey);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }
}
