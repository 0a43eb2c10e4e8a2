package com.vinow.marketplace.common.exception;

/**
 * BizException - 마켓플레이스 비즈니스 예외의 최상위 클래스
 *
 * 예외 계층:
 * BizException
 * ├─ DomainException (NotFound / InvalidState / Validation)
 * ├─ ApplicationException (ConcurrencyConflict)
 * └─ SystemException (ExternalIO)
 *
 * 호출자(API 계층)는 {@link ErrorCode#getStatusCode()}로 응답 코드를 결정한다.
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
