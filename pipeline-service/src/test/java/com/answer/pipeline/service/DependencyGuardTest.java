package com.answer.pipeline.service;

import com.answer.pipeline.config.PipelineProperties;
import com.answer.pipeline.cost.CostTracker;
import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.RequestFingerprint;
import com.answer.pipeline.resilience.BreakerSettings;
import com.answer.pipeline.resilience.CircuitBreakerRegistry;
import com.answer.pipeline.resilience.CircuitState;
import com.answer.pipeline.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DependencyGuardTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final PipelineProperties.Budget budget = new PipelineProperties.Budget();
    private final CostTracker costTracker = new CostTracker(budget, clock);
    private final CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(BreakerSettings.defaults(), clock);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final DependencyGuard guard = new DependencyGuard(breakers, costTracker, executor, meterRegistry);
    private final RunContext context = new RunContext("trace-1", new RequestFingerprint("fp-guard"), Duration.ofSeconds(5));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void successfulMeteredCallIsChargedToLedgerAndRun() {
        StageResult<String> result = guard.submit(
                DependencyGuard.Call.metered("search:brave", "brave", 0.005, Duration.ofSeconds(1), () -> "ok"),
                context).join();

        assertThat(result.outcome()).isEqualTo(StageResult.Outcome.SUCCESS);
        assertThat(result.value()).isEqualTo("ok");
        assertThat(costTracker.recordsFor("fp-guard")).hasSize(1);
        assertThat(context.totalCost()).isCloseTo(0.005, within(1e-12));
    }

    @Test
    void freeCallsLeaveNoCostRecords() {
        guard.submit(DependencyGuard.Call.free("enhance", Duration.ofSeconds(1), () -> "q"), context).join();

        assertThat(costTracker.recordsFor("fp-guard")).isEmpty();
        assertThat(context.costs()).isEmpty();
    }

    @Test
    void failureKeepsItsKindAndIsNotCharged() {
        StageResult<String> result = guard.submit(
                DependencyGuard.Call.<String>metered("search:serpapi", "serpapi", 0.01, Duration.ofSeconds(1), () -> {
                    throw new DependencyFailureException("serpapi", FailureKind.RATE_LIMITED, "429");
                }),
                context).join();

        assertThat(result.isFailed()).isTrue();
        assertThat(result.failureKind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(breakers.forDependency("search:serpapi").snapshot().failureCount()).isEqualTo(1);
        assertThat(costTracker.recordsFor("fp-guard")).isEmpty();
    }

    @Test
    void slowCallTimesOut() {
        CountDownLatch never = new CountDownLatch(1);

        StageResult<String> result = guard.submit(
                DependencyGuard.Call.free("fetch:zenrows", Duration.ofMillis(50), () -> {
                    try {
                        never.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }),
                context).join();

        never.countDown();
        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(meterRegistry.counter("pipeline_stage_timeout_total", "dependency", "fetch:zenrows").count()).isEqualTo(1.0);
    }

    @Test
    void timedOutCallIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();

        StageResult<String> result = guard.submit(
                DependencyGuard.Call.free("search:brave", Duration.ofMillis(50), () -> {
                    try {
                        Thread.sleep(2_000);
                        finished.incrementAndGet();
                    } catch (InterruptedException ex) {
                        interrupted.countDown();
                    }
                    return "late";
                }),
                context).join();

        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(finished.get()).isZero();
    }

    @Test
    void runDeadlineCutsStageTimeoutShort() throws InterruptedException {
        RunContext shortRun = new RunContext("trace-3", new RequestFingerprint("fp-short"), Duration.ofMillis(100));
        CountDownLatch interrupted = new CountDownLatch(1);
        long start = System.nanoTime();

        StageResult<String> result = guard.submit(
                DependencyGuard.Call.free("fetch:zenrows", Duration.ofSeconds(5), () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ex) {
                        interrupted.countDown();
                    }
                    return "late";
                }),
                shortRun).join();

        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2_000);
        assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(shortRun.isExpired()).isTrue();
    }

    @Test
    void openCircuitShortCircuitsWithoutCallingDependency() {
        for (int i = 0; i < 5; i++) {
            breakers.forDependency("search:brave").onFailure();
        }
        AtomicInteger invocations = new AtomicInteger();

        StageResult<Integer> result = guard.submit(
                DependencyGuard.Call.metered("search:brave", "brave", 0.005, Duration.ofSeconds(1), invocations::incrementAndGet),
                context).join();

        assertThat(result.failureKind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
        assertThat(invocations.get()).isZero();
    }

    @Test
    void deniedBudgetSkipsCallAndLeavesCircuitAlone() {
        budget.getProviderDailyUsd().put("serpapi", 0.001);
        AtomicInteger invocations = new AtomicInteger();

        StageResult<Integer> result = guard.submit(
                DependencyGuard.Call.metered("search:serpapi", "serpapi", 0.01, Duration.ofSeconds(1), invocations::incrementAndGet),
                context).join();

        assertThat(result.failureKind()).isEqualTo(FailureKind.BUDGET_DENIED);
        assertThat(invocations.get()).isZero();
        assertThat(breakers.forDependency("search:serpapi").getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.forDependency("search:serpapi").snapshot().failureCount()).isZero();
    }

    @Test
    void expiredDeadlineFailsFastAndReturnsTrialPermit() {
        RunContext expired = new RunContext("trace-2", new RequestFingerprint("fp-expired"), Duration.ZERO);
        AtomicInteger invocations = new AtomicInteger();

        StageResult<Integer> result = guard.submit(
                DependencyGuard.Call.free("enhance", Duration.ofSeconds(1), invocations::incrementAndGet), expired).join();

        assertThat(result.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(invocations.get()).isZero();
    }
}
