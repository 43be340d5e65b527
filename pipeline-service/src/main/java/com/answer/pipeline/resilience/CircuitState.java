package com.answer.pipeline.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
