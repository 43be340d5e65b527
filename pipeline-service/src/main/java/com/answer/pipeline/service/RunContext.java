package com.answer.pipeline.service;

import com.answer.pipeline.model.CostRecord;
import com.answer.pipeline.model.RequestFingerprint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class RunContext {

    private final String traceId;
    private final RequestFingerprint fingerprint;
    private final long startNanos;
    private final long deadlineNanos;
    private final List<CostRecord> costs = new ArrayList<>();

    public RunContext(String traceId, RequestFingerprint fingerprint, Duration timeout) {
        this.traceId = traceId;
        this.fingerprint = fingerprint;
        this.startNanos = System.nanoTime();
        this.deadlineNanos = startNanos + timeout.toNanos();
    }

    public String traceId() {
        return traceId;
    }

    public RequestFingerprint fingerprint() {
        return fingerprint;
    }

    public long remainingMillis() {
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    /**
     * True once less than a millisecond is left, the same granularity stage timeouts use.
     */
    public boolean isExpired() {
        return remainingMillis() <= 0;
    }

    /**
     * {@code stageTimeoutMs} cut down to what is left of the overall deadline.
     */
    public Duration boundedTimeout(long stageTimeoutMs) {
        return Duration.ofMillis(Math.min(stageTimeoutMs, remainingMillis()));
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    public synchronized void addCost(CostRecord record) {
        costs.add(record);
    }

    public synchronized List<CostRecord> costs() {
        return List.copyOf(costs);
    }

    public synchronized double totalCost() {
        double total = 0.0;
        for (CostRecord record : costs) {
            total += record.amount();
        }
        return total;
    }
}
