package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 현재 주문 상태에서 요청한 작업을 수행할 수 없음 (InvalidState)
 *
 * 예: 이미 VERIFIED 된 주문을 다시 검증, COMPLETED 주문에 환불 요청
 */
@Getter
public class InvalidOrderStatusException extends DomainException {

    private final OrderStatus currentStatus;

    public InvalidOrderStatusException(Long orderId, OrderStatus currentStatus, String operation) {
        super(ErrorCode.INVALID_ORDER_STATUS,
                String.format("orderId=%d, status=%s, operation=%s", orderId, currentStatus, operation));
        this.currentStatus = currentStatus;
    }

    protected InvalidOrderStatusException(ErrorCode errorCode, OrderStatus currentStatus, String detailMessage) {
        super(errorCode, detailMessage);
        this.currentStatus = currentStatus;
    }
}
