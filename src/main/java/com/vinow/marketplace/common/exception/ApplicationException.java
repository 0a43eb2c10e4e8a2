package com.vinow.marketplace.common.exception;

/**
 * ApplicationException - 규칙은 만족하지만 처리 과정이 실패한 경우
 *
 * 대표적으로 주문 단위 락 경합에서 진 경우({@link ConcurrencyConflictException}).
 * 코어는 자동 재시도하지 않으며, 호출자가 최신 상태로 한 번만 재시도할 수 있다.
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
