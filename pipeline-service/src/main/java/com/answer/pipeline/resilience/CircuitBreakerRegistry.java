package com.answer.pipeline.resilience;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class CircuitBreakerRegistry {

    private final BreakerSettings settings;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(BreakerSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public CircuitBreaker forDependency(String dependency) {
        return breakers.computeIfAbsent(dependency, name -> new CircuitBreaker(name, settings, clock));
    }

    public List<CircuitSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::dependency))
                .collect(Collectors.toList());
    }

    public boolean anyOpen() {
        return breakers.values().stream().anyMatch(breaker -> breaker.getState() != CircuitState.CLOSED);
    }
}
