package com.answer.pipeline.service;

import com.answer.pipeline.cache.CacheCategory;
import com.answer.pipeline.cache.TieredCacheService;
import com.answer.pipeline.client.ContentFetcher;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.FetchedSource;
import com.answer.pipeline.model.RequestFingerprint;
import com.answer.pipeline.model.SearchHit;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

public class FetchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FetchCoordinator.class);

    private final ContentFetcher fetcher;
    private final DependencyGuard guard;
    private final TieredCacheService cache;
    private final int concurrency;
    private final int maxContentLength;
    private final long fetchTimeoutMs;
    private final MeterRegistry meterRegistry;

    public FetchCoordinator(
            ContentFetcher fetcher,
            DependencyGuard guard,
            TieredCacheService cache,
            int concurrency,
            int maxContentLength,
            long fetchTimeoutMs,
            MeterRegistry meterRegistry
    ) {
        this.fetcher = fetcher;
        this.guard = guard;
        this.cache = cache;
        this.concurrency = Math.max(1, concurrency);
        this.maxContentLength = Math.max(1, maxContentLength);
        this.fetchTimeoutMs = fetchTimeoutMs;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the usable sources in hit order. FAILED when none could be fetched.
     */
    public StageResult<List<FetchedSource>> fetch(List<SearchHit> hits, RunContext context) {
        FetchedSource[] fetched = new FetchedSource[hits.size()];
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        Semaphore permits = new Semaphore(concurrency);

        for (int i = 0; i < hits.size(); i++) {
            SearchHit hit = hits.get(i);
            Optional<FetchedSource> cached = cache.get(cacheKey(hit.url()), CacheCategory.CONTENT, FetchedSource.class);
            if (cached.isPresent()) {
                fetched[i] = cached.get();
                continue;
            }
            if (!acquire(permits, context)) {
                log.warn("trace_id={} stage=fetch event=fetch_skipped remaining_urls={}", context.traceId(), hits.size() - i);
                break;
            }
            int slot = i;
            DependencyGuard.Call<FetchedSource> call = DependencyGuard.Call.metered(
                    "fetch:" + fetcher.name(),
                    fetcher.name(),
                    fetcher.costPerFetch(),
                    Duration.ofMillis(fetchTimeoutMs),
                    () -> fetcher.fetch(hit.url())
            );
            pending.add(guard.submit(call, context)
                    .whenComplete((result, error) -> permits.release())
                    .thenAccept(result -> fetched[slot] = settle(hit, result, context)));
        }
        for (CompletableFuture<Void> future : pending) {
            future.join();
        }

        List<FetchedSource> usable = new ArrayList<>();
        int failures = 0;
        for (FetchedSource source : fetched) {
            if (source != null && source.isUsable()) {
                usable.add(source);
            } else {
                failures++;
            }
        }
        log.info("trace_id={} stage=fetch requested={} usable={} failed={}",
                context.traceId(), hits.size(), usable.size(), failures);
        if (usable.isEmpty()) {
            return StageResult.failed(FailureKind.ERROR, "none of " + hits.size() + " sources could be fetched");
        }
        return failures == 0 ? StageResult.success(usable) : StageResult.degraded(usable, failures + " sources dropped");
    }

    private FetchedSource settle(SearchHit hit, StageResult<FetchedSource> result, RunContext context) {
        if (result.isFailed() || result.value() == null) {
            incrementCounter("pipeline_fetch_failed_total");
            log.info("trace_id={} stage=fetch event=source_dropped url={} kind={}",
                    context.traceId(), hit.url(), result.failureKind());
            return FetchedSource.failed(hit.url());
        }
        FetchedSource source = result.value();
        String title = source.title() == null || source.title().isBlank() ? hit.title() : source.title();
        FetchedSource normalised = new FetchedSource(hit.url(), title, source.extractedText(), source.fetchStatus())
                .bounded(maxContentLength);
        if (normalised.isUsable()) {
            cache.set(cacheKey(hit.url()), normalised, CacheCategory.CONTENT);
        }
        return normalised;
    }

    private static boolean acquire(Semaphore permits, RunContext context) {
        try {
            return permits.tryAcquire(context.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static String cacheKey(String url) {
        return RequestFingerprint.sha256(url);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "fetcher", fetcher.name()).increment();
    }
}
