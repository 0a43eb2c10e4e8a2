package com.vinow.marketplace.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

/**
 * Jackson 공통 설정
 *
 * Boot 기본 ObjectMapper에 적용되며, QR 페이로드 해석과 Kafka 이벤트 직렬화가 같은 설정을 쓴다.
 * - java.time 값은 ISO-8601 문자열
 * - 업무 시간대(marketplace.finance.zone) 기준
 * - 알 수 없는 필드는 무시
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer marketplaceJacksonCustomizer(MarketplaceProperties properties) {
        return builder -> builder
                .modulesToInstall(new JavaTimeModule())
                .timeZone(TimeZone.getTimeZone(properties.getFinance().getZone()))
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
