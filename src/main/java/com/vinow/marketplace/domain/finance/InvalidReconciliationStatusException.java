package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;

public class InvalidReconciliationStatusException extends DomainException {

    public InvalidReconciliationStatusException(Long reconciliationId, ReconciliationStatus status) {
        super(ErrorCode.INVALID_RECONCILIATION_STATUS,
                String.format("reconciliationId=%d, status=%s", reconciliationId, status));
    }
}
