package com.vinow.marketplace.infrastructure.lock;

import java.util.function.Supplier;

/**
 * 주문 단위 상호 배제 가드
 *
 * 구현체:
 * - LocalOrderLockManager: 단일 프로세스 (주문별 ReentrantLock)
 * - RedissonOrderLockManager: 여러 인스턴스 (Redisson RLock)
 *
 * marketplace.lock.type(LOCAL | REDIS)으로 선택한다.
 * 대기 시간 안에 락을 얻지 못하면 ConcurrencyConflictException을 던진다.
 */
public interface OrderLockManager {

    <T> T executeWithLock(String lockKey, Supplier<T> task);
}
