package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 상태 전환표에 없는 전환 요청 (InvalidTransition)
 */
@Getter
public class InvalidOrderTransitionException extends InvalidOrderStatusException {

    private final OrderStatus targetStatus;

    public InvalidOrderTransitionException(Long orderId, OrderStatus currentStatus, OrderStatus targetStatus) {
        super(ErrorCode.INVALID_ORDER_TRANSITION, currentStatus,
                String.format("orderId=%d, %s → %s", orderId, currentStatus, targetStatus));
        this.targetStatus = targetStatus;
    }
}
