package com.vinow.marketplace.domain.finance;

/**
 * 대사 결과 상태
 *
 * MISMATCHED → RESOLVED: 불일치 주문 전체에 이의 제기가 접수된 경우
 */
public enum ReconciliationStatus {
    MATCHED,
    MISMATCHED,
    RESOLVED
}
