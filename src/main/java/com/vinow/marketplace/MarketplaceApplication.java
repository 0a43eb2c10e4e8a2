package com.vinow.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Marketplace 주문/정산 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 이벤트 Kafka 중계를 비동기로 실행
 * - @EnableScheduling: 재무 배치 스케줄 실행
 * - @EnableAspectJAutoProxy: @SchedulerLock 메서드 프록시 생성
 * - @ConfigurationPropertiesScan: marketplace.* 설정 바인딩
 */
@EnableAsync
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication
public class MarketplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketplaceApplication.class, args);
    }

}
