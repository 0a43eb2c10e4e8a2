package com.vinow.marketplace.domain.order.event;

import com.vinow.marketplace.domain.order.Order;
import com.vinow.marketplace.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * OrderStatusChangedEvent - 주문 상태 전환 이벤트
 *
 * 트랜잭션 커밋 후 OrderEventRelayListener가 Kafka(order-events 토픽)로 전달한다.
 * Kafka JSON 직렬화를 위해 기본 생성자를 가진다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedEvent {

    private Long orderId;
    private String orderNumber;
    private Long merchantId;
    private OrderStatus fromStatus;
    private OrderStatus toStatus;
    private String actor;
    private String reason;
    private Long finalAmount;
    private LocalDateTime occurredAt;

    public static OrderStatusChangedEvent of(Order order, OrderStatus fromStatus, String actor, String reason) {
        return new OrderStatusChangedEvent(
                order.getOrderId(),
                order.getOrderNumber(),
                order.getMerchantId(),
                fromStatus,
                order.getOrderStatus(),
                actor,
                reason,
                order.getFinalAmount(),
                order.getUpdatedAt()
        );
    }
}
