package com.vinow.marketplace.common.id;

import lombok.Getter;

/**
 * 비즈니스 식별자 접두어
 */
@Getter
public enum IdPrefix {
    ORDER("ORD"),
    PAYMENT("PAY"),
    REFUND("REF"),
    SETTLEMENT("SET");

    private final String value;

    IdPrefix(String value) {
        this.value = value;
    }
}
