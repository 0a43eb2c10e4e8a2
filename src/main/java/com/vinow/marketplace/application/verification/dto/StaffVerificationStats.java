package com.vinow.marketplace.application.verification.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class StaffVerificationStats {
    private String staffId;
    private String staffName;
    private long verificationCount;
    private long totalAmount;
}
