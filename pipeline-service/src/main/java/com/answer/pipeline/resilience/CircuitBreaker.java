package com.answer.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Failure-count breaker for a single dependency.
 *
 * <p>CLOSED keeps the time of every failure younger than {@code failureWindow} and opens
 * once the threshold is reached; a success only drops the oldest one. OPEN rejects calls
 * until {@code openedUntil}. The first {@link #tryAcquire()} after that moves to HALF_OPEN
 * and admits exactly one trial, which either closes the circuit or reopens it for longer.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String dependency;
    private final BreakerSettings settings;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private final Deque<Instant> failures = new ArrayDeque<>();
    private Instant lastFailureAt;
    private Instant openedUntil;
    private Duration currentOpenDuration;
    private boolean trialInFlight;
    private long shortCircuited;

    public CircuitBreaker(String dependency, BreakerSettings settings, Clock clock) {
        this.dependency = dependency;
        this.settings = settings;
        this.clock = clock;
        this.currentOpenDuration = settings.openDuration();
    }

    /**
     * Asks for permission to call the dependency. A {@code true} answer must be followed by
     * exactly one of {@link #onSuccess()}, {@link #onFailure()} or {@link #release()}.
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (now.isBefore(openedUntil)) {
                    shortCircuited++;
                    return false;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    shortCircuited++;
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("unknown state " + state);
        }
    }

    public synchronized void onSuccess() {
        switch (state) {
            case HALF_OPEN:
                trialInFlight = false;
                failures.clear();
                currentOpenDuration = settings.openDuration();
                transitionTo(CircuitState.CLOSED);
                break;
            case CLOSED:
                failures.pollFirst();
                break;
            default:
                // a call admitted before the circuit opened finished late; the open period stands
                break;
        }
    }

    public synchronized void onFailure() {
        Instant now = clock.instant();
        lastFailureAt = now;
        switch (state) {
            case HALF_OPEN:
                trialInFlight = false;
                currentOpenDuration = backedOff(currentOpenDuration);
                open(now);
                break;
            case CLOSED:
                dropExpired(now);
                failures.addLast(now);
                if (failures.size() >= settings.failureThreshold()) {
                    open(now);
                }
                break;
            default:
                break;
        }
    }

    /**
     * Returns a permit without an outcome, for calls that were abandoned before reaching
     * the dependency.
     */
    public synchronized void release() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitSnapshot snapshot() {
        if (state == CircuitState.CLOSED) {
            dropExpired(clock.instant());
        }
        return new CircuitSnapshot(dependency, state, failures.size(), lastFailureAt,
                state == CircuitState.CLOSED ? null : openedUntil, shortCircuited);
    }

    private void dropExpired(Instant now) {
        Instant cutoff = now.minus(settings.failureWindow());
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
            failures.pollFirst();
        }
    }

    private void open(Instant now) {
        openedUntil = now.plus(currentOpenDuration);
        transitionTo(CircuitState.OPEN);
    }

    private Duration backedOff(Duration current) {
        long next = (long) (current.toMillis() * settings.backoffMultiplier());
        return Duration.ofMillis(Math.min(next, settings.maxOpenDuration().toMillis()));
    }

    private void transitionTo(CircuitState next) {
        if (state == next) {
            return;
        }
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            log.warn("event=circuit_transition dependency={} from={} to={} failures={} open_ms={}",
                    dependency, previous, next, failures.size(), currentOpenDuration.toMillis());
        } else {
            log.info("event=circuit_transition dependency={} from={} to={}", dependency, previous, next);
        }
    }
}
