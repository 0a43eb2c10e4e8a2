package com.vinow.marketplace.application.verification.dto;

import com.vinow.marketplace.domain.verification.VerificationRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class VerificationRecordPageResult {
    private List<VerificationRecord> records;
    private int page;
    private int size;
    private long totalCount;
}
