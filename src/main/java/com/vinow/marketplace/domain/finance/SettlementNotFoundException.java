package com.vinow.marketplace.domain.finance;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;

public class SettlementNotFoundException extends DomainException {

    public SettlementNotFoundException(Long settlementId) {
        super(ErrorCode.SETTLEMENT_NOT_FOUND, "settlementId=" + settlementId);
    }
}
