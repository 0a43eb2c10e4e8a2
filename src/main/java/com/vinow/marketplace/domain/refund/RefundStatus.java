package com.vinow.marketplace.domain.refund;

public enum RefundStatus {
    REQUESTED,
    APPROVED,
    REJECTED
}
