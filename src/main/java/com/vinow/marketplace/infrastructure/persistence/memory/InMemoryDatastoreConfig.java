package com.vinow.marketplace.infrastructure.persistence.memory;

import com.vinow.marketplace.infrastructure.persistence.InMemoryDatastore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * 메모리 저장소 모드 구성 (local 프로필)
 *
 * DataSource/JPA 자동 구성은 application-local.yml에서 제외한다.
 */
@Configuration
@InMemoryDatastore
public class InMemoryDatastoreConfig {

    @Bean
    public PlatformTransactionManager transactionManager() {
        return new InMemoryTransactionManager();
    }
}
