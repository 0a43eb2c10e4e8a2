package com.vinow.marketplace.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Producer 설정 (주문 상태 변경 이벤트 릴레이)
 *
 * marketplace.events.kafka-enabled=true 일 때만 활성화된다.
 * 코어는 이벤트를 발행만 하며 소비하지 않는다.
 */
@Configuration
@ConditionalOnProperty(prefix = "marketplace.events", name = "kafka-enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    public ProducerFactory<String, OrderStatusChangedEvent> orderEventProducerFactory(ObjectMapper objectMapper) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        // 안정성 설정
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        // 값은 공통 ObjectMapper로 직렬화, 타입 헤더 없음
        JsonSerializer<OrderStatusChangedEvent> valueSerializer =
                new JsonSerializer<OrderStatusChangedEvent>(objectMapper).noTypeInfo();
        return new DefaultKafkaProducerFactory<>(configProps, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, OrderStatusChangedEvent> orderEventKafkaTemplate(
            ProducerFactory<String, OrderStatusChangedEvent> orderEventProducerFactory) {
        return new KafkaTemplate<>(orderEventProducerFactory);
    }
}
