package com.answer.pipeline.service;

import com.answer.pipeline.cost.CostTracker;
import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.CostRecord;
import com.answer.pipeline.resilience.CircuitBreaker;
import com.answer.pipeline.resilience.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

public class DependencyGuard {

    private static final Logger log = LoggerFactory.getLogger(DependencyGuard.class);

    private final CircuitBreakerRegistry breakers;
    private final CostTracker costTracker;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public DependencyGuard(CircuitBreakerRegistry breakers, CostTracker costTracker, Executor executor) {
        this(breakers, costTracker, executor, null);
    }

    public DependencyGuard(CircuitBreakerRegistry breakers, CostTracker costTracker, Executor executor, MeterRegistry meterRegistry) {
        this.breakers = breakers;
        this.costTracker = costTracker;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public <T> CompletableFuture<StageResult<T>> submit(Call<T> call, RunContext context) {
        if (call.costProvider() != null
                && !costTracker.reserve(call.costProvider(), call.estimatedCost()).isAllowed()) {
            incrementCounter("pipeline_dependency_short_circuit_total", call.dependency());
            return CompletableFuture.completedFuture(
                    StageResult.failed(FailureKind.BUDGET_DENIED, "budget exhausted for " + call.costProvider()));
        }

        CircuitBreaker breaker = breakers.forDependency(call.dependency());
        if (!breaker.tryAcquire()) {
            incrementCounter("pipeline_dependency_short_circuit_total", call.dependency());
            return CompletableFuture.completedFuture(
                    StageResult.failed(FailureKind.CIRCUIT_OPEN, "circuit open for " + call.dependency()));
        }

        long timeoutMs = context.boundedTimeout(call.timeout().toMillis()).toMillis();
        if (timeoutMs <= 0) {
            breaker.release();
            return CompletableFuture.completedFuture(StageResult.failed(FailureKind.TIMEOUT, "request deadline reached"));
        }

        long start = System.nanoTime();
        CompletableFuture<T> attempt = new CompletableFuture<>();
        FutureTask<Void> task = new FutureTask<>(() -> {
            try {
                attempt.complete(call.action().get());
            } catch (Throwable ex) {
                attempt.completeExceptionally(ex);
            }
        }, null);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            breaker.release();
            log.warn("trace_id={} event=dependency_rejected dependency={} cause={}",
                    context.traceId(), call.dependency(), ex.getMessage());
            return CompletableFuture.completedFuture(StageResult.failed(FailureKind.ERROR, "dependency executor saturated"));
        }

        return attempt
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error != null) {
                        // interrupts a call still running, or drops one still queued
                        task.cancel(true);
                    }
                })
                .handle((value, error) -> {
                    recordTimer(call.dependency(), start);
                    if (error == null) {
                        breaker.onSuccess();
                        chargeFor(call, value, context);
                        return StageResult.success(value);
                    }
                    breaker.onFailure();
                    Throwable cause = unwrap(error);
                    FailureKind kind = classify(cause);
                    if (kind == FailureKind.TIMEOUT) {
                        incrementCounter("pipeline_stage_timeout_total", call.dependency());
                    }
                    log.warn("trace_id={} event=dependency_failed dependency={} kind={} duration_ms={} cause={}",
                            context.traceId(), call.dependency(), kind, elapsedMillis(start), cause.getMessage());
                    return StageResult.<T>failed(kind, cause.getMessage());
                });
    }

    private <T> void chargeFor(Call<T> call, T value, RunContext context) {
        if (call.costProvider() == null) {
            return;
        }
        double amount = call.actualCost() == null ? call.estimatedCost() : call.actualCost().applyAsDouble(value);
        if (amount <= 0.0) {
            return;
        }
        CostRecord record = costTracker.record(call.costProvider(), amount, context.fingerprint().value());
        context.addCost(record);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static FailureKind classify(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (cause instanceof DependencyFailureException) {
            return ((DependencyFailureException) cause).getFailureKind();
        }
        return FailureKind.ERROR;
    }

    private void recordTimer(String dependency, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer("pipeline_dependency_latency", "dependency", dependency)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName, String dependency) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "dependency", dependency).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * One guarded invocation. {@code costProvider} may be null for free collaborators;
     * {@code actualCost} may be null to charge the estimate.
     */
    public record Call<T>(
            String dependency,
            String costProvider,
            double estimatedCost,
            Duration timeout,
            Supplier<T> action,
            ToDoubleFunction<T> actualCost
    ) {
        public static <T> Call<T> free(String dependency, Duration timeout, Supplier<T> action) {
            return new Call<>(dependency, null, 0.0, timeout, action, null);
        }

        public static <T> Call<T> metered(String dependency, String costProvider, double cost, Duration timeout, Supplier<T> action) {
            return new Call<>(dependency, costProvider, cost, timeout, action, null);
        }
    }
}
