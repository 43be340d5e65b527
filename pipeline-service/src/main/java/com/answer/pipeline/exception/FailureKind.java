package com.answer.pipeline.exception;

/**
 * Why a single collaborator call did not produce a value. The first two never reach the
 * network.
 */
public enum FailureKind {
    CIRCUIT_OPEN,
    BUDGET_DENIED,
    TIMEOUT,
    RATE_LIMITED,
    NOT_FOUND,
    BLOCKED,
    MODEL_UNAVAILABLE,
    ERROR;

    public boolean isShortCircuit() {
        return this == CIRCUIT_OPEN || this == BUDGET_DENIED;
    }
}
