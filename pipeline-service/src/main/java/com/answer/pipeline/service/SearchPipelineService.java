package com.answer.pipeline.service;

import com.answer.pipeline.audit.AuditSink;
import com.answer.pipeline.cache.CacheCategory;
import com.answer.pipeline.cache.TieredCacheService;
import com.answer.pipeline.client.AnswerSynthesizer;
import com.answer.pipeline.client.QueryEnhancer;
import com.answer.pipeline.config.PipelineProperties;
import com.answer.pipeline.cost.CostTracker;
import com.answer.pipeline.exception.NoUsableSourcesException;
import com.answer.pipeline.exception.PipelineException;
import com.answer.pipeline.exception.PipelineTimeoutException;
import com.answer.pipeline.model.FetchedSource;
import com.answer.pipeline.model.PipelineResponse;
import com.answer.pipeline.model.RequestFingerprint;
import com.answer.pipeline.model.SearchHit;
import com.answer.pipeline.model.SearchRequest;
import com.answer.pipeline.model.SynthesisResult;
import com.answer.pipeline.resilience.CircuitBreakerRegistry;
import com.answer.pipeline.resilience.CircuitSnapshot;
import com.answer.pipeline.resilience.CircuitState;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class SearchPipelineService {

    private static final Logger log = LoggerFactory.getLogger(SearchPipelineService.class);

    static final double DEGRADED_CONFIDENCE = 0.3;
    static final int DEGRADED_EXCERPTS = 3;
    static final int DEGRADED_EXCERPT_CHARS = 300;
    private static final long AWAIT_GRACE_MS = 1_000L;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final QueryEnhancer queryEnhancer;
    private final SearchAggregator searchAggregator;
    private final FetchCoordinator fetchCoordinator;
    private final AnswerSynthesizer answerSynthesizer;
    private final DependencyGuard guard;
    private final TieredCacheService cache;
    private final CircuitBreakerRegistry breakers;
    private final CostTracker costTracker;
    private final AuditSink auditSink;
    private final Executor pipelineExecutor;
    private final PipelineProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, CompletableFuture<PipelineResponse>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong singleFlightJoins = new AtomicLong();
    private final AtomicLong degradedResponses = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public SearchPipelineService(
            QueryEnhancer queryEnhancer,
            SearchAggregator searchAggregator,
            FetchCoordinator fetchCoordinator,
            AnswerSynthesizer answerSynthesizer,
            DependencyGuard guard,
            TieredCacheService cache,
            CircuitBreakerRegistry breakers,
            CostTracker costTracker,
            AuditSink auditSink,
            @Qualifier("pipelineExecutor") Executor pipelineExecutor,
            PipelineProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.queryEnhancer = queryEnhancer;
        this.searchAggregator = searchAggregator;
        this.fetchCoordinator = fetchCoordinator;
        this.answerSynthesizer = answerSynthesizer;
        this.guard = guard;
        this.cache = cache;
        this.breakers = breakers;
        this.costTracker = costTracker;
        this.auditSink = auditSink == null ? AuditSink.noop() : auditSink;
        this.pipelineExecutor = pipelineExecutor;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public PipelineResponse run(SearchRequest request) {
        return run(request, UUID.randomUUID().toString());
    }

    public PipelineResponse run(SearchRequest request, String traceId) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        requests.incrementAndGet();
        incrementCounter("pipeline_requests_total");
        try {
            SearchRequest accepted = RequestValidator.validate(request);
            RequestFingerprint fingerprint = RequestFingerprint.of(accepted);
            log.info("trace_id={} event=pipeline_start fingerprint={} query=\"{}\" max_results={}",
                    effectiveTraceId, fingerprint.shortValue(), sanitizeForLog(accepted.query()), accepted.effectiveMaxResults());

            CompletableFuture<PipelineResponse> created = new CompletableFuture<>();
            CompletableFuture<PipelineResponse> existing = inFlight.putIfAbsent(fingerprint.value(), created);
            if (existing != null) {
                singleFlightJoins.incrementAndGet();
                incrementCounter("pipeline_single_flight_join_total");
                log.info("trace_id={} event=single_flight_join fingerprint={}", effectiveTraceId, fingerprint.shortValue());
                return await(existing, effectiveTraceId);
            }
            lead(created, accepted, fingerprint, effectiveTraceId);
            return await(created, effectiveTraceId);
        } catch (PipelineException ex) {
            failures.incrementAndGet();
            incrementCounter("pipeline_failures_total");
            log.info("trace_id={} event=pipeline_failed kind={} message=\"{}\"", effectiveTraceId, ex.getKind(), ex.getMessage());
            throw ex;
        }
    }

    /**
     * Starts the shared computation on the pipeline executor. Callers only ever wait on
     * the future, so a caller giving up never cancels the run for the others.
     */
    private void lead(CompletableFuture<PipelineResponse> created, SearchRequest request,
                      RequestFingerprint fingerprint, String traceId) {
        Runnable task = () -> {
            PipelineResponse response;
            try {
                response = execute(request, fingerprint, traceId);
            } catch (Throwable ex) {
                inFlight.remove(fingerprint.value(), created);
                created.completeExceptionally(ex);
                return;
            }
            // release the slot before publishing the result
            inFlight.remove(fingerprint.value(), created);
            created.complete(response);
        };
        try {
            pipelineExecutor.execute(task);
        } catch (RuntimeException ex) {
            inFlight.remove(fingerprint.value(), created);
            created.completeExceptionally(ex);
        }
    }

    private PipelineResponse await(CompletableFuture<PipelineResponse> future, String traceId) {
        long waitMs = properties.getTimeouts().getRequestMs() + AWAIT_GRACE_MS;
        try {
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new PipelineTimeoutException("request did not complete within " + waitMs + " ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PipelineTimeoutException("interrupted while waiting for the pipeline", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            log.error("trace_id={} event=pipeline_error cause={}", traceId, cause.toString());
            throw new IllegalStateException("pipeline run failed", cause);
        }
    }

    PipelineResponse execute(SearchRequest request, RequestFingerprint fingerprint, String traceId) {
        long lookupStart = System.nanoTime();
        Optional<PipelineResponse> cached = cache.get(fingerprint.value(), CacheCategory.RESPONSE, PipelineResponse.class);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            incrementCounter("pipeline_response_cache_hit_total");
            double lookupSeconds = (System.nanoTime() - lookupStart) / 1_000_000_000.0;
            log.info("trace_id={} event=pipeline_cache_hit fingerprint={} lookup_ms={}",
                    traceId, fingerprint.shortValue(), lookupSeconds * 1000.0);
            return cached.get().asCached(lookupSeconds);
        }

        executions.incrementAndGet();
        RunContext context = new RunContext(traceId, fingerprint, Duration.ofMillis(properties.getTimeouts().getRequestMs()));
        int maxResults = request.effectiveMaxResults();

        long stageStart = System.nanoTime();
        List<String> queries = enhance(request.query(), context);
        logStage(context, "enhance", stageStart, "queries=" + queries.size());
        if (context.isExpired()) {
            throw timeoutWithNothing("enhance");
        }

        stageStart = System.nanoTime();
        StageResult<List<SearchHit>> searched = searchAggregator.search(queries, maxResults, context);
        logStage(context, "search", stageStart, searched.outcomeLabel());
        if (searched.isFailed()) {
            if (context.isExpired()) {
                throw timeoutWithNothing("search");
            }
            throw new NoUsableSourcesException("every search provider failed for every query");
        }
        List<SearchHit> ranked = SearchAggregator.mergeAndRank(searched.value(), maxResults);
        if (ranked.isEmpty()) {
            throw new NoUsableSourcesException("search returned no results");
        }
        if (context.isExpired()) {
            return finish(request, context, degradedFromHits(ranked), true);
        }

        stageStart = System.nanoTime();
        StageResult<List<FetchedSource>> fetched = fetchCoordinator.fetch(ranked, context);
        logStage(context, "fetch", stageStart, fetched.outcomeLabel());
        if (fetched.isFailed()) {
            if (context.isExpired()) {
                return finish(request, context, degradedFromHits(ranked), true);
            }
            throw new NoUsableSourcesException("none of the " + ranked.size() + " candidate sources could be fetched");
        }
        List<FetchedSource> sources = fetched.value();
        if (context.isExpired()) {
            return finish(request, context, degradedFromSources(sources), true);
        }

        stageStart = System.nanoTime();
        StageResult<SynthesisResult> synthesized = synthesize(request.query(), sources, context);
        logStage(context, "synthesize", stageStart, synthesized.outcomeLabel());
        if (synthesized.isFailed()) {
            return finish(request, context, degradedFromSources(sources), true);
        }
        return finish(request, context, answerFrom(synthesized.value(), sources), false);
    }

    private List<String> enhance(String query, RunContext context) {
        String cacheKey = RequestFingerprint.sha256(RequestFingerprint.normalizeQuery(query));
        Optional<List<String>> cached = cache.get(cacheKey, CacheCategory.ENHANCEMENT, STRING_LIST);
        if (cached.isPresent() && !cached.get().isEmpty()) {
            return cached.get();
        }
        DependencyGuard.Call<List<String>> call = DependencyGuard.Call.free(
                "enhance",
                Duration.ofMillis(properties.getTimeouts().getEnhanceMs()),
                () -> queryEnhancer.enhance(query)
        );
        StageResult<List<String>> result = guard.submit(call, context).join();
        if (result.isFailed()) {
            log.info("trace_id={} stage=enhance event=fallback_raw_query kind={}", context.traceId(), result.failureKind());
            return List.of(query);
        }
        List<String> queries = mergeQueries(query, result.value(), properties.getSearch().getMaxEnhancedQueries());
        cache.set(cacheKey, queries, CacheCategory.ENHANCEMENT);
        return queries;
    }

    /**
     * Raw query first, then the variants, de-duplicated case-insensitively and capped.
     */
    static List<String> mergeQueries(String query, List<String> variants, int cap) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> merged = new ArrayList<>();
        merged.add(query);
        seen.add(RequestFingerprint.normalizeQuery(query));
        if (variants != null) {
            for (String variant : variants) {
                if (merged.size() >= Math.max(1, cap)) {
                    break;
                }
                if (variant == null || variant.isBlank()) {
                    continue;
                }
                if (seen.add(RequestFingerprint.normalizeQuery(variant))) {
                    merged.add(variant.trim());
                }
            }
        }
        return merged;
    }

    private StageResult<SynthesisResult> synthesize(String query, List<FetchedSource> sources, RunContext context) {
        DependencyGuard.Call<SynthesisResult> call = new DependencyGuard.Call<>(
                "synthesize:" + answerSynthesizer.model(),
                answerSynthesizer.name(),
                answerSynthesizer.estimateCost(query, sources),
                Duration.ofMillis(properties.getTimeouts().getSynthesizeMs()),
                () -> answerSynthesizer.synthesize(query, sources),
                answerSynthesizer::actualCost
        );
        return guard.submit(call, context).join();
    }

    private PipelineResponse finish(SearchRequest request, RunContext context, Draft draft, boolean degraded) {
        List<String> sources = request.effectiveIncludeSources() ? draft.sources() : List.of();
        PipelineResponse response = new PipelineResponse(
                request.query(),
                draft.answer(),
                sources,
                draft.confidence(),
                context.elapsedSeconds(),
                false,
                context.totalCost(),
                clock.instant().truncatedTo(ChronoUnit.MILLIS),
                degraded,
                context.fingerprint().value()
        );
        if (degraded) {
            degradedResponses.incrementAndGet();
            incrementCounter("pipeline_degraded_total");
        }
        cache.set(context.fingerprint().value(), response, CacheCategory.RESPONSE);
        auditSink.appendResponse(response);
        recordTimer("pipeline_request_duration", response.processingTime());
        log.info("trace_id={} event=pipeline_complete total_ms={} sources={} confidence={} cost={} degraded={}",
                context.traceId(),
                response.processingTime() * 1000.0,
                response.sources().size(),
                response.confidence(),
                response.costEstimate(),
                degraded);
        return response;
    }

    private static Draft answerFrom(SynthesisResult result, List<FetchedSource> sources) {
        Set<String> fetchedUrls = new LinkedHashSet<>();
        for (FetchedSource source : sources) {
            fetchedUrls.add(source.url());
        }
        List<String> used = new ArrayList<>();
        for (String url : result.sourcesUsed()) {
            if (fetchedUrls.contains(url) && !used.contains(url)) {
                used.add(url);
            }
        }
        if (used.isEmpty()) {
            used.addAll(fetchedUrls);
        }
        double confidence = Math.min(1.0, Math.max(0.0, result.confidence()));
        return new Draft(result.answerText(), used, confidence);
    }

    static Draft degradedFromSources(List<FetchedSource> sources) {
        StringBuilder answer = new StringBuilder("A synthesized answer is not available right now. Key excerpts from the top sources:");
        List<String> urls = new ArrayList<>();
        int count = 0;
        for (FetchedSource source : sources) {
            if (count >= DEGRADED_EXCERPTS) {
                break;
            }
            answer.append("\n\n[").append(count + 1).append("] ")
                    .append(labelFor(source.title(), source.url())).append(": ")
                    .append(excerpt(source.extractedText()));
            urls.add(source.url());
            count++;
        }
        return new Draft(answer.toString(), urls, DEGRADED_CONFIDENCE);
    }

    static Draft degradedFromHits(List<SearchHit> hits) {
        StringBuilder answer = new StringBuilder("A synthesized answer is not available right now. Top search results:");
        List<String> urls = new ArrayList<>();
        int count = 0;
        for (SearchHit hit : hits) {
            if (count >= DEGRADED_EXCERPTS) {
                break;
            }
            answer.append("\n\n[").append(count + 1).append("] ")
                    .append(labelFor(hit.title(), hit.url())).append(": ")
                    .append(excerpt(hit.snippet()));
            urls.add(hit.url());
            count++;
        }
        return new Draft(answer.toString(), urls, DEGRADED_CONFIDENCE);
    }

    private PipelineTimeoutException timeoutWithNothing(String stage) {
        incrementCounter("pipeline_deadline_exceeded_total");
        return new PipelineTimeoutException("request deadline reached during " + stage + " with nothing usable");
    }

    public PipelineStats stats() {
        return new PipelineStats(
                requests.get(),
                cacheHits.get(),
                executions.get(),
                singleFlightJoins.get(),
                degradedResponses.get(),
                failures.get(),
                inFlight.size(),
                breakers.snapshots(),
                costTracker.summary(),
                cache.stats()
        );
    }

    /**
     * Per-component status plus an {@code overall} entry: healthy, degraded when any
     * circuit is not closed or the shared cache is unreachable, unhealthy without search
     * providers.
     */
    public Map<String, String> health() {
        Map<String, String> components = new LinkedHashMap<>();
        String cacheStatus = cache.health();
        components.put("cache", cacheStatus);
        components.put("search_providers", searchAggregator.providerNames().isEmpty() ? "unhealthy" : "healthy");
        for (CircuitSnapshot snapshot : breakers.snapshots()) {
            components.put(snapshot.dependency(), snapshot.state() == CircuitState.CLOSED ? "healthy" : "degraded");
        }
        String overall = "healthy";
        for (String status : components.values()) {
            if ("unhealthy".equals(status)) {
                overall = "unhealthy";
                break;
            }
            if (!"healthy".equals(status)) {
                overall = "degraded";
            }
        }
        Map<String, String> report = new LinkedHashMap<>();
        report.put("overall", overall);
        report.putAll(components);
        return report;
    }

    /**
     * Drops every cached value and in-process entry. In-flight runs are not affected.
     */
    public void clearCache() {
        cache.clear();
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    private void logStage(RunContext context, String stage, long startNanos, String outcome) {
        double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        log.info("trace_id={} stage={} duration_ms={} outcome={}", context.traceId(), stage, durationMs, outcome);
        if (meterRegistry != null) {
            meterRegistry.timer("pipeline_stage_duration", "stage", stage)
                    .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    private void recordTimer(String metricName, double seconds) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record((long) (seconds * 1_000_000_000L), TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private static String labelFor(String title, String url) {
        return title == null || title.isBlank() ? url : title.trim();
    }

    private static String excerpt(String text) {
        if (text == null || text.isBlank()) {
            return "(no excerpt available)";
        }
        String flat = text.trim().replaceAll("\\s+", " ");
        return flat.length() > DEGRADED_EXCERPT_CHARS ? flat.substring(0, DEGRADED_EXCERPT_CHARS) + "..." : flat;
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    record Draft(String answer, List<String> sources, double confidence) {
    }
}
