package com.vinow.marketplace.infrastructure.kafka;

import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import com.vinow.marketplace.infrastructure.config.MarketplaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 주문 상태 변경 이벤트 Kafka 발행
 *
 * 메시지 키는 orderId → 같은 주문의 이벤트는 같은 파티션에 순서대로 적재된다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "marketplace.events", name = "kafka-enabled", havingValue = "true")
public class OrderEventProducer {

    private final KafkaTemplate<String, OrderStatusChangedEvent> kafkaTemplate;
    private final String topicName;

    public OrderEventProducer(KafkaTemplate<String, OrderStatusChangedEvent> kafkaTemplate,
                              MarketplaceProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicName = properties.getEvents().getOrderTopic();
    }

    public CompletableFuture<SendResult<String, OrderStatusChangedEvent>> publish(OrderStatusChangedEvent event) {
        String key = String.valueOf(event.getOrderId());

        log.info("[OrderEventProducer] Kafka 메시지 발행 시작 - topic={}, key={}, {} → {}",
                topicName, key, event.getFromStatus(), event.getToStatus());

        CompletableFuture<SendResult<String, OrderStatusChangedEvent>> future =
                kafkaTemplate.send(topicName, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                var metadata = result.getRecordMetadata();
                log.info("[OrderEventProducer] Kafka 메시지 발행 성공 - topic={}, partition={}, offset={}, orderId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), event.getOrderId());
            } else {
                log.error("[OrderEventProducer] Kafka 메시지 발행 실패 - topic={}, key={}, orderId={}",
                        topicName, key, event.getOrderId(), ex);
            }
        });
        return future;
    }
}
