package com.vinow.marketplace.infrastructure.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.inmemory.InMemoryLockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock 설정 - 스케줄 작업 중복 실행 방지
 *
 * 인스턴스 A: 작업 실행 시도 → 락 획득 성공 → 실행
 * 인스턴스 B: 작업 실행 시도 → 락 획득 실패 → 스킵
 *
 * 프로세스가 재시작되어도 이전 실행의 락이 lockAtMostFor 동안 유지되므로
 * 진행 중인 작업을 다시 트리거하지 않는다.
 *
 * - REDIS: 여러 인스턴스 간 공유 (Redis 키 네임스페이스 "vinow-marketplace")
 * - LOCAL: 단일 프로세스 (로컬 개발/테스트)
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "PT30M")
public class ShedLockConfig {

    private static final String LOCK_ENVIRONMENT = "vinow-marketplace";

    @Bean
    @ConditionalOnProperty(prefix = "marketplace.lock", name = "type", havingValue = "REDIS")
    public LockProvider redisLockProvider(RedisConnectionFactory connectionFactory) {
        return new RedisLockProvider(connectionFactory, LOCK_ENVIRONMENT);
    }

    @Bean
    @ConditionalOnProperty(prefix = "marketplace.lock", name = "type", havingValue = "LOCAL", matchIfMissing = true)
    public LockProvider inMemoryLockProvider() {
        return new InMemoryLockProvider();
    }
}
