package com.vinow.marketplace.application.finance.job;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 대상(가맹점 또는 리포트 행) 1건의 처리 결과
 */
@Getter
@AllArgsConstructor
public class TaskOutcome {

    private final String targetKey;
    private final TaskStatus status;
    private final String message;

    public static TaskOutcome of(String targetKey, TaskStatus status) {
        return new TaskOutcome(targetKey, status, null);
    }

    public static TaskOutcome failed(String targetKey, String message) {
        return new TaskOutcome(targetKey, TaskStatus.FAILED, message);
    }
}
