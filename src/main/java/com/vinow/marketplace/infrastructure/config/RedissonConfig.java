package com.vinow.marketplace.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Redisson 설정 (주문별 분산 락)
 *
 * Redisson은 spring.data.redis 설정을 자동으로 사용하지 않으므로,
 * Boot가 바인딩한 RedisProperties로 RedissonClient Bean을 직접 구성한다.
 * ShedLock(RedisLockProvider)과 같은 Redis를 바라본다.
 *
 * marketplace.lock.type=REDIS 일 때만 생성된다. LOCAL 모드에서는 Redis 연결을 만들지 않는다.
 */
@Configuration
@ConditionalOnProperty(prefix = "marketplace.lock", name = "type", havingValue = "REDIS")
public class RedissonConfig {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    /**
     * Single Server 모드 (redis://host:port), 프로세스 종료 시 shutdown
     */
    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Duration timeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : DEFAULT_TIMEOUT;

        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress("redis://" + redisProperties.getHost() + ":" + redisProperties.getPort())
                .setDatabase(redisProperties.getDatabase())
                .setTimeout((int) timeout.toMillis())
                .setConnectionPoolSize(20)
                .setConnectionMinimumIdleSize(5);
        if (redisProperties.getPassword() != null && !redisProperties.getPassword().isBlank()) {
            server.setPassword(redisProperties.getPassword());
        }

        return Redisson.create(config);
    }
}
