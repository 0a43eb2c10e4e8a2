package com.vinow.marketplace.domain.finance;

/**
 * 정산 상태
 *
 * PROCESSING → COMPLETED
 * PROCESSING → FAILED → (재실행) COMPLETED
 */
public enum SettlementStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
