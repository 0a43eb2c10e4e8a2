package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;

public class InvalidSettlementStatusException extends DomainException {

    public InvalidSettlementStatusException(String settlementNo, SettlementStatus status, String operation) {
        super(ErrorCode.INVALID_SETTLEMENT_STATUS,
                String.format("settlementNo=%s, status=%s, operation=%s", settlementNo, status, operation));
    }
}
