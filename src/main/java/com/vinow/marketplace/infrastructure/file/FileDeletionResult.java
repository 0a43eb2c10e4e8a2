package com.vinow.marketplace.infrastructure.file;

public enum FileDeletionResult {
    DELETED,
    ALREADY_MISSING,
    REMOTE_SKIPPED
}
