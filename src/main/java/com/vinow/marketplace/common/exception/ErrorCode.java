package com.vinow.marketplace.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_ORDER_NOT_FOUND, APP_ORDER_CONCURRENCY_CONFLICT
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Common
    VALIDATION_FAILED("DOMAIN_VALIDATION_FAILED", "요청 값이 유효하지 않습니다", 400),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    VERIFICATION_CODE_NOT_FOUND("DOMAIN_ORDER_VERIFICATION_CODE_NOT_FOUND", "검증 코드에 해당하는 주문이 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "현재 주문 상태에서 허용되지 않는 작업입니다", 409),
    INVALID_ORDER_TRANSITION("DOMAIN_ORDER_INVALID_TRANSITION", "허용되지 않는 주문 상태 전환입니다", 409),

    // Finance Domain
    SETTLEMENT_NOT_FOUND("DOMAIN_FINANCE_SETTLEMENT_NOT_FOUND", "정산 기록을 찾을 수 없습니다", 404),
    INVALID_SETTLEMENT_STATUS("DOMAIN_FINANCE_INVALID_SETTLEMENT_STATUS", "현재 정산 상태에서 허용되지 않는 작업입니다", 409),
    RECONCILIATION_NOT_FOUND("DOMAIN_FINANCE_RECONCILIATION_NOT_FOUND", "대사 기록을 찾을 수 없습니다", 404),
    INVALID_RECONCILIATION_STATUS("DOMAIN_FINANCE_INVALID_RECONCILIATION_STATUS", "이의 제기가 불가능한 대사 상태입니다", 409),

    // ========== Application Layer Errors ==========

    CONCURRENCY_CONFLICT("APP_ORDER_CONCURRENCY_CONFLICT", "다른 요청이 주문을 처리 중입니다", 409),
    ID_GENERATION_FAILED("APP_ID_GENERATION_FAILED", "식별자 생성에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    DATASTORE_ERROR("SYSTEM_DATASTORE_ERROR", "데이터스토어 오류가 발생했습니다", 503),
    FILE_IO_ERROR("SYSTEM_FILE_IO_ERROR", "파일 처리 중 오류가 발생했습니다", 503),
    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "락 획득 중 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
