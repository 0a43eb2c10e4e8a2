package com.vinow.marketplace.application.verification.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class VerificationFailure {
    private Long orderId;
    private String errorCode;
    private String reason;
}
