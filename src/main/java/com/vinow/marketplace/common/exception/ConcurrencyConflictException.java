package com.vinow.marketplace.common.exception;

/**
 * 주문 단위 가드(락 대기 시간 초과 또는 버전 충돌) 경합에서 진 경우
 */
public class ConcurrencyConflictException extends ApplicationException {

    public ConcurrencyConflictException(String detailMessage) {
        super(ErrorCode.CONCURRENCY_CONFLICT, detailMessage);
    }

    public ConcurrencyConflictException(String detailMessage, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, detailMessage, cause);
    }
}
