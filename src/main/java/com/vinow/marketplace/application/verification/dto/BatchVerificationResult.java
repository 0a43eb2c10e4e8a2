package com.vinow.marketplace.application.verification.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 일괄 검증 결과
 *
 * 입력 ID마다 정확히 하나의 결과가 남는다: succeeded.size() + failed.size() == totalProcessed
 */
public class BatchVerificationResult {

    private final List<Long> succeeded = new ArrayList<>();
    private final List<VerificationFailure> failed = new ArrayList<>();

    public void addSuccess(Long orderId) {
        succeeded.add(orderId);
    }

    public void addFailure(VerificationFailure failure) {
        failed.add(failure);
    }

    public List<Long> getSucceeded() {
        return Collections.unmodifiableList(succeeded);
    }

    public List<VerificationFailure> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public int getTotalProcessed() {
        return succeeded.size() + failed.size();
    }
}
