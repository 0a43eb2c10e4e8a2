package com.vinow.marketplace.domain.order;

import com.vinow.marketplace.common.exception.DomainException;
import com.vinow.marketplace.common.exception.ErrorCode;

public class VerificationCodeNotFoundException extends DomainException {

    public VerificationCodeNotFoundException(String verificationCode) {
        super(ErrorCode.VERIFICATION_CODE_NOT_FOUND, "code=" + verificationCode);
    }
}
