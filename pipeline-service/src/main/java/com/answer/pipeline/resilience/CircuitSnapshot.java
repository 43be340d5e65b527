package com.answer.pipeline.resilience;

import java.time.Instant;

/**
 * Read-only view of one breaker, taken under its lock.
 */
public record CircuitSnapshot(
        String dependency,
        CircuitState state,
        int failureCount,
        Instant lastFailureAt,
        Instant openedUntil,
        long shortCircuited
) {
}
