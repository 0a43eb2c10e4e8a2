package com.vinow.marketplace.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외 (4XX)
 *
 * 사용 예:
 * - OrderNotFoundException: 주문/검증코드 조회 실패
 * - InvalidOrderStatusException: 현재 상태에서 허용되지 않는 작업
 * - ValidationException: 필수 값 누락, 잘못된 QR 페이로드
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public DomainException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
