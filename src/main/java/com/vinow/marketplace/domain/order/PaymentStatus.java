package com.vinow.marketplace.domain.order;

/**
 * 결제 상태 (결제/에스크로 협력 시스템이 통지)
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED
}
