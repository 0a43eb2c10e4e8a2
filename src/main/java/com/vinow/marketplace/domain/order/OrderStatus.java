package com.vinow.marketplace.domain.order;

/**
 * OrderStatus - 주문 생명주기 상태
 *
 * 정상 흐름: PENDING → CONFIRMED → PREPARING → READY → VERIFIED → COMPLETED
 * 취소: PENDING | CONFIRMED | PREPARING | READY → CANCELLED
 * 환불: PENDING | VERIFIED → REFUNDING → REFUNDED (또는 환불 직전 상태로 복원)
 *
 * 전환 가능 여부는 {@link OrderTransitionPolicy}가 판단한다.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PREPARING,
    READY,
    VERIFIED,
    COMPLETED,
    CANCELLED,
    REFUNDING,
    REFUNDED;

    /**
     * 종료 상태 여부 (더 이상 전환 불가)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REFUNDED;
    }
}
