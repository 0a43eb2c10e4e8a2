package com.vinow.marketplace.domain.verification;

/**
 * 사용(검증) 방식
 */
public enum VerificationMethod {
    CODE,
    QR,
    BATCH
}
