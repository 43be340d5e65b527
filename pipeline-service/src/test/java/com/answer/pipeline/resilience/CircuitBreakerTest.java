package com.answer.pipeline.resilience;

import com.answer.pipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final BreakerSettings settings = new BreakerSettings(
            5, Duration.ofSeconds(60), Duration.ofSeconds(30), 2.0, Duration.ofMinutes(5));

    @Test
    void opensAtThresholdAndRejectsUntilOpenPeriodEnds() {
        CircuitBreaker breaker = new CircuitBreaker("search:brave", settings, clock);

        for (int i = 0; i < 4; i++) {
            assertThat(breaker.tryAcquire()).isTrue();
            breaker.onFailure();
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.tryAcquire()).isTrue();
        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.tryAcquire()).isFalse();
        assertThat(breaker.snapshot().openedUntil()).isEqualTo(Instant.parse("2024-05-01T10:00:30Z"));
        assertThat(breaker.snapshot().shortCircuited()).isEqualTo(1);
    }

    @Test
    void halfOpenAdmitsSingleTrialAndClosesOnSuccess() {
        CircuitBreaker breaker = tripped();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.tryAcquire()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.tryAcquire()).isFalse();

        breaker.onSuccess();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isZero();
        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    void failedTrialReopensWithBackedOffDuration() {
        CircuitBreaker breaker = tripped();
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquire()).isTrue();

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.snapshot().openedUntil()).isEqualTo(clock.instant().plus(Duration.ofSeconds(60)));

        clock.advance(Duration.ofSeconds(59));
        assertThat(breaker.tryAcquire()).isFalse();
        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    void backoffIsCappedAtMaxOpenDuration() {
        CircuitBreaker breaker = tripped();
        for (int i = 0; i < 6; i++) {
            clock.advance(Duration.ofMinutes(10));
            assertThat(breaker.tryAcquire()).isTrue();
            breaker.onFailure();
        }

        assertThat(breaker.snapshot().openedUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    }

    @Test
    void successOnlyDecrementsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("fetch:zenrows", settings, clock);
        for (int i = 0; i < 4; i++) {
            breaker.onFailure();
        }

        breaker.onSuccess();
        assertThat(breaker.snapshot().failureCount()).isEqualTo(3);

        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void failuresOutsideWindowStartANewCount() {
        CircuitBreaker breaker = new CircuitBreaker("enhance", settings, clock);
        for (int i = 0; i < 4; i++) {
            breaker.onFailure();
        }
        clock.advance(Duration.ofSeconds(61));

        breaker.onFailure();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.snapshot().failureCount()).isEqualTo(1);
    }

    @Test
    void failuresAgeOutOfTheWindowOneByOne() {
        CircuitBreaker breaker = new CircuitBreaker("search:serpapi", settings, clock);
        for (int i = 0; i < 3; i++) {
            breaker.onFailure();
        }
        clock.advance(Duration.ofSeconds(40));
        breaker.onFailure();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.snapshot().failureCount()).isEqualTo(1);
        breaker.onFailure();
        breaker.onFailure();
        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);

        breaker.onFailure();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void releasedTrialPermitCanBeTakenAgain() {
        CircuitBreaker breaker = tripped();
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.tryAcquire()).isTrue();

        breaker.release();

        assertThat(breaker.tryAcquire()).isTrue();
    }

    @Test
    void registryKeepsOneBreakerPerDependency() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(settings, clock);

        CircuitBreaker first = registry.forDependency("search:brave");
        registry.forDependency("search:serpapi");

        assertThat(registry.forDependency("search:brave")).isSameAs(first);
        assertThat(registry.snapshots()).extracting(CircuitSnapshot::dependency)
                .containsExactly("search:brave", "search:serpapi");
        assertThat(registry.anyOpen()).isFalse();
    }

    private CircuitBreaker tripped() {
        CircuitBreaker breaker = new CircuitBreaker("synthesize:llama2", settings, clock);
        for (int i = 0; i < 5; i++) {
            breaker.onFailure();
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        return breaker;
    }
}
