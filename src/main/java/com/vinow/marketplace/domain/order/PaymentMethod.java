package com.vinow.marketplace.domain.order;

public enum PaymentMethod {
    MOMO,
    ZALO_PAY,
    CASH,
    BANK_CARD,
    CREDIT_CARD
}
