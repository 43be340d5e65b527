package com.answer.pipeline.support;

import com.answer.pipeline.client.SearchProvider;
import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.SearchHit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Returns a fixed list of URLs for every query, or fails with {@link FailureKind#ERROR}.
 */
public class StubSearchProvider implements SearchProvider {

    private final String name;
    private final double cost;
    private final List<String> urls;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger interruptions = new AtomicInteger();
    private volatile boolean failing;
    private volatile CountDownLatch gate;
    private volatile long delayMs;

    public StubSearchProvider(String name, double cost, String... urls) {
        this.name = name;
        this.cost = cost;
        this.urls = List.of(urls);
    }

    public StubSearchProvider failing() {
        this.failing = true;
        return this;
    }

    /**
     * Blocks every call until {@code latch} is released.
     */
    public StubSearchProvider gatedBy(CountDownLatch latch) {
        this.gate = latch;
        return this;
    }

    public StubSearchProvider withDelay(long millis) {
        this.delayMs = millis;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    /**
     * Calls that were interrupted while blocked on the gate or the delay.
     */
    public int interruptions() {
        return interruptions.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double costPerCall() {
        return cost;
    }

    @Override
    public List<SearchHit> search(String query, int limit) {
        calls.incrementAndGet();
        CountDownLatch latch = gate;
        try {
            if (latch != null) {
                latch.await(5, TimeUnit.SECONDS);
            }
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
        } catch (InterruptedException ex) {
            interruptions.incrementAndGet();
            Thread.currentThread().interrupt();
            throw new DependencyFailureException(name, FailureKind.TIMEOUT, "interrupted", ex);
        }
        if (failing) {
            throw new DependencyFailureException(name, FailureKind.ERROR, name + " unavailable");
        }
        List<SearchHit> hits = new ArrayList<>();
        for (int i = 0; i < urls.size() && i < limit; i++) {
            hits.add(new SearchHit(urls.get(i), "Title " + urls.get(i), "snippet for " + urls.get(i), name, i + 1));
        }
        return hits;
    }
}
