package com.answer.pipeline.service;

import com.answer.pipeline.exception.FailureKind;

/**
 * Outcome of one pipeline stage or one guarded collaborator call.
 */
public record StageResult<T>(Outcome outcome, T value, FailureKind failureKind, String detail) {

    public enum Outcome {
        SUCCESS,
        DEGRADED,
        FAILED
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Outcome.SUCCESS, value, null, null);
    }

    public static <T> StageResult<T> degraded(T value, String detail) {
        return new StageResult<>(Outcome.DEGRADED, value, null, detail);
    }

    public static <T> StageResult<T> failed(FailureKind failureKind, String detail) {
        return new StageResult<>(Outcome.FAILED, null, failureKind, detail);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    public String outcomeLabel() {
        return outcome == Outcome.FAILED && failureKind != null ? "FAILED_" + failureKind : outcome.name();
    }
}
