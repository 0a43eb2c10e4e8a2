package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;

public class ReconciliationNotFoundException extends DomainException {

    public ReconciliationNotFoundException(Long reconciliationId) {
        super(ErrorCode.RECONCILIATION_NOT_FOUND, "reconciliationId=" + reconciliationId);
    }
}
