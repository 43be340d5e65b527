package com.answer.pipeline.resilience;

import java.time.Duration;

public record BreakerSettings(
        int failureThreshold,
        Duration failureWindow,
        Duration openDuration,
        double backoffMultiplier,
        Duration maxOpenDuration
) {
    public BreakerSettings {
        failureThreshold = Math.max(1, failureThreshold);
        backoffMultiplier = Math.max(1.0, backoffMultiplier);
        if (maxOpenDuration.compareTo(openDuration) < 0) {
            maxOpenDuration = openDuration;
        }
    }

    public static BreakerSettings defaults() {
        return new BreakerSettings(5, Duration.ofSeconds(60), Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));
    }
}
