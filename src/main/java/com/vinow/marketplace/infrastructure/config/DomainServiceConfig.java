package com.vinow.marketplace.infrastructure.config;

import com.vinow.marketplace.domain.order.OrderTransitionPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 순수 도메인 서비스 Bean 등록
 *
 * 도메인 계층은 Spring에 의존하지 않으므로 여기서 생성한다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public OrderTransitionPolicy orderTransitionPolicy(MarketplaceProperties properties) {
        return new OrderTransitionPolicy(properties.getOrder().getRedeemableStatuses());
    }

    /**
     * 업무 시각 기준 시계 (Asia/Ho_Chi_Minh)
     */
    @Bean
    public Clock businessClock(MarketplaceProperties properties) {
        return Clock.system(properties.getFinance().getZone());
    }
}
