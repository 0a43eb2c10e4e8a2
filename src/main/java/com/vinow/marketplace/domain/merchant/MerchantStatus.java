package com.vinow.marketplace.domain.merchant;

public enum MerchantStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
