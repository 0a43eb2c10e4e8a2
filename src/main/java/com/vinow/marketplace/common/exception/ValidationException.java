package com.vinow.marketplace.common.exception;

/**
 * 필수 값 누락 또는 형식 오류 (예: 거절 사유 없음, 해석 불가능한 QR 페이로드)
 */
public class ValidationException extends DomainException {

    public ValidationException(String detailMessage) {
        super(ErrorCode.VALIDATION_FAILED, detailMessage);
    }

    public ValidationException(String detailMessage, Throwable cause) {
        super(ErrorCode.VALIDATION_FAILED, detailMessage, cause);
    }
}
