package com.vinow.marketplace.application.finance.job;

public enum TaskStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
