package com.vinow.marketplace.application.order.listener;

import com.vinow.marketplace.domain.order.event.OrderStatusChangedEvent;
import com.vinow.marketplace.infrastructure.kafka.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 상태 변경 이벤트를 커밋 이후 Kafka로 전달
 *
 * 롤백된 전환은 발행되지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "marketplace.events", name = "kafka-enabled", havingValue = "true")
public class OrderEventRelayListener {

    private final OrderEventProducer orderEventProducer;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderStatusChanged(OrderStatusChangedEvent event) {
        log.debug("[OrderEventRelayListener] 이벤트 수신 - orderId={}, {} → {}",
                event.getOrderId(), event.getFromStatus(), event.getToStatus());
        orderEventProducer.publish(event);
    }
}
