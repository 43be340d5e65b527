package com.answer.pipeline.service;

import com.answer.pipeline.audit.AuditSink;
import com.answer.pipeline.cache.InMemoryCacheTier;
import com.answer.pipeline.cache.TieredCacheService;
import com.answer.pipeline.client.RuleBasedQueryEnhancer;
import com.answer.pipeline.config.PipelineProperties;
import com.answer.pipeline.cost.CostTracker;
import com.answer.pipeline.exception.NoUsableSourcesException;
import com.answer.pipeline.exception.PipelineTimeoutException;
import com.answer.pipeline.exception.ValidationException;
import com.answer.pipeline.model.CostRecord;
import com.answer.pipeline.model.PipelineResponse;
import com.answer.pipeline.model.RequestFingerprint;
import com.answer.pipeline.model.SearchRequest;
import com.answer.pipeline.resilience.BreakerSettings;
import com.answer.pipeline.resilience.CircuitBreakerRegistry;
import com.answer.pipeline.support.MutableClock;
import com.answer.pipeline.support.StubAnswerSynthesizer;
import com.answer.pipeline.support.StubContentFetcher;
import com.answer.pipeline.support.StubSearchProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SearchPipelineServiceTest {

    private static final String[] BRAVE_URLS = {
            "https://a.example/1", "https://b.example/2", "https://c.example/3", "https://d.example/4", "https://e.example/5"
    };
    private static final String[] SERPAPI_URLS = {
            "https://b.example/2", "https://f.example/6", "https://g.example/7", "https://h.example/8", "https://i.example/9"
    };

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ExecutorService pipelineExecutor = Executors.newCachedThreadPool();
    private final ExecutorService dependencyExecutor = Executors.newCachedThreadPool();
    private final ExecutorService callers = Executors.newFixedThreadPool(8);
    private final PipelineProperties properties = new PipelineProperties();
    private final List<PipelineResponse> audited = new CopyOnWriteArrayList<>();

    private StubSearchProvider brave = new StubSearchProvider("brave", 0.005, BRAVE_URLS);
    private StubSearchProvider serpapi = new StubSearchProvider("serpapi", 0.01, SERPAPI_URLS);
    private StubContentFetcher fetcher = new StubContentFetcher(0.01);
    private StubAnswerSynthesizer synthesizer = new StubAnswerSynthesizer(0.002);
    private long requestMs = 10_000;
    private CircuitBreakerRegistry breakerRegistry;
    private CostTracker costTracker;
    private SearchPipelineService service;

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        pipelineExecutor.shutdownNow();
        dependencyExecutor.shutdownNow();
    }

    @Test
    void answersQueryFromFetchedSources() {
        build();

        PipelineResponse response = service.run(new SearchRequest("latest AI developments", 8, true));

        assertThat(response.answer()).isNotBlank();
        assertThat(response.cached()).isFalse();
        assertThat(response.degraded()).isFalse();
        assertThat(response.sources()).hasSize(8).doesNotHaveDuplicates();
        assertThat(response.sources().get(0)).isEqualTo("https://b.example/2");
        assertThat(response.confidence()).isBetween(0.0, 1.0);
        assertThat(response.fingerprint())
                .isEqualTo(RequestFingerprint.of(new SearchRequest("latest AI developments", 8, true)).value());
        assertThat(audited).containsExactly(response);
    }

    @Test
    void costEstimateMatchesRecordedCosts() {
        build();

        PipelineResponse response = service.run(SearchRequest.of("latest AI developments"));

        List<CostRecord> records = costTracker.recordsFor(response.fingerprint());
        double recorded = records.stream().mapToDouble(CostRecord::amount).sum();
        assertThat(records).isNotEmpty();
        assertThat(response.costEstimate()).isCloseTo(recorded, within(1e-9));
        assertThat(records).extracting(CostRecord::provider).contains("brave", "serpapi", "zenrows", "ollama");
    }

    @Test
    void repeatedQueryIsServedFromCacheWithoutNewCosts() {
        build();
        PipelineResponse first = service.run(SearchRequest.of("what is caching"));
        int recordsAfterFirst = costTracker.recordsFor(first.fingerprint()).size();
        int searchCalls = brave.calls();

        PipelineResponse second = service.run(SearchRequest.of("  What is   CACHING "));

        assertThat(second.cached()).isTrue();
        assertThat(second).usingRecursiveComparison()
                .ignoringFields("cached", "processingTime", "query")
                .isEqualTo(first);
        assertThat(costTracker.recordsFor(first.fingerprint())).hasSize(recordsAfterFirst);
        assertThat(brave.calls()).isEqualTo(searchCalls);
        assertThat(service.stats().cacheHits()).isEqualTo(1);
    }

    @Test
    void sequentialRepeatsAlwaysHitTheCache() {
        build();

        for (int i = 0; i < 100; i++) {
            SearchRequest request = SearchRequest.of("repeat query " + i, 3);
            PipelineResponse first = service.run(request);
            PipelineResponse second = service.run(request);

            assertThat(first.cached()).isFalse();
            assertThat(second.cached()).as("repeat %d", i).isTrue();
        }
        assertThat(service.stats().executions()).isEqualTo(100);
        assertThat(service.stats().singleFlightJoins()).isZero();
    }

    @Test
    void concurrentIdenticalRequestsShareOneExecution() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        brave.gatedBy(gate);
        build();

        List<Future<PipelineResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(callers.submit(() -> service.run(SearchRequest.of("single flight query"))));
        }
        waitForJoins(7);
        gate.countDown();

        List<PipelineResponse> responses = new ArrayList<>();
        for (Future<PipelineResponse> future : futures) {
            responses.add(future.get());
        }
        assertThat(service.stats().executions()).isEqualTo(1);
        assertThat(responses).allSatisfy(response -> assertThat(response).isSameAs(responses.get(0)));
        assertThat(synthesizer.calls()).isEqualTo(1);
    }

    @Test
    void failedFetchesShrinkTheSourceList() {
        brave = new StubSearchProvider("brave", 0.005, BRAVE_URLS);
        serpapi = new StubSearchProvider("serpapi", 0.01);
        fetcher = new StubContentFetcher(0.01).failOn(BRAVE_URLS[0], BRAVE_URLS[2], BRAVE_URLS[4]);
        build();

        PipelineResponse response = service.run(SearchRequest.of("fetch failures", 5));

        assertThat(response.degraded()).isFalse();
        assertThat(response.sources()).containsExactly(BRAVE_URLS[1], BRAVE_URLS[3]);
    }

    @Test
    void noFetchableSourcesIsAnError() {
        fetcher = new StubContentFetcher(0.01).failAll();
        build();

        assertThatThrownBy(() -> service.run(SearchRequest.of("nothing fetches", 5)))
                .isInstanceOf(NoUsableSourcesException.class);
        assertThat(service.stats().failures()).isEqualTo(1);
    }

    @Test
    void allSearchProvidersFailingIsAnError() {
        brave = new StubSearchProvider("brave", 0.005).failing();
        serpapi = new StubSearchProvider("serpapi", 0.01).failing();
        build();

        assertThatThrownBy(() -> service.run(SearchRequest.of("no search")))
                .isInstanceOf(NoUsableSourcesException.class);
        assertThat(fetcher.calls()).isZero();
    }

    @Test
    void synthesisFailureDegradedAnswerIsCached() {
        synthesizer = new StubAnswerSynthesizer(0.002).failing();
        build();

        PipelineResponse first = service.run(SearchRequest.of("model is down", 5));
        int recordsAfterFirst = costTracker.recordsFor(first.fingerprint()).size();
        PipelineResponse second = service.run(SearchRequest.of("model is down", 5));

        assertThat(first.degraded()).isTrue();
        assertThat(first.confidence()).isEqualTo(SearchPipelineService.DEGRADED_CONFIDENCE);
        assertThat(first.sources()).hasSize(3);
        assertThat(first.answer()).contains("[1]").contains("[3]").doesNotContain("[4]");
        assertThat(second.cached()).isTrue();
        assertThat(second.degraded()).isTrue();
        assertThat(second.answer()).isEqualTo(first.answer());
        assertThat(service.stats().executions()).isEqualTo(1);
        assertThat(synthesizer.calls()).isEqualTo(1);
        assertThat(costTracker.recordsFor(first.fingerprint())).hasSize(recordsAfterFirst)
                .extracting(CostRecord::provider).doesNotContain("ollama");
    }

    @Test
    void deadlineAfterSearchAnswersFromSnippets() throws InterruptedException {
        requestMs = 300;
        serpapi = new StubSearchProvider("serpapi", 0.01, SERPAPI_URLS).withDelay(3_000);
        build();

        PipelineResponse response = service.run(SearchRequest.of("deadline after search", 5));

        assertThat(response.degraded()).isTrue();
        assertThat(response.confidence()).isEqualTo(SearchPipelineService.DEGRADED_CONFIDENCE);
        assertThat(response.answer()).startsWith("A synthesized answer is not available right now. Top search results:");
        assertThat(response.sources()).containsExactly(BRAVE_URLS[0], BRAVE_URLS[1], BRAVE_URLS[2]);
        assertThat(fetcher.calls()).isZero();
        assertThat(synthesizer.calls()).isZero();
        awaitInterrupted(serpapi);
    }

    @Test
    void deadlineAfterFetchAnswersFromFetchedSources() {
        requestMs = 300;
        serpapi = new StubSearchProvider("serpapi", 0.01);
        fetcher = new StubContentFetcher(0.01).slowOn(3_000, BRAVE_URLS[1], BRAVE_URLS[3]);
        build();

        PipelineResponse response = service.run(SearchRequest.of("deadline after fetch", 5));

        assertThat(response.degraded()).isTrue();
        assertThat(response.answer()).startsWith("A synthesized answer is not available right now. Key excerpts from the top sources:");
        assertThat(response.sources()).containsExactly(BRAVE_URLS[0], BRAVE_URLS[2], BRAVE_URLS[4]);
        assertThat(synthesizer.calls()).isZero();
    }

    @Test
    void deadlineWithNothingUsableTimesOut() throws InterruptedException {
        requestMs = 300;
        brave = new StubSearchProvider("brave", 0.005, BRAVE_URLS).withDelay(3_000);
        serpapi = new StubSearchProvider("serpapi", 0.01, SERPAPI_URLS).withDelay(3_000);
        build();
        long start = System.nanoTime();

        assertThatThrownBy(() -> service.run(SearchRequest.of("nothing in time", 5)))
                .isInstanceOf(PipelineTimeoutException.class);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2_000);
        assertThat(fetcher.calls()).isZero();
        assertThat(service.stats().failures()).isEqualTo(1);
        awaitInterrupted(brave);
        awaitInterrupted(serpapi);
    }

    @Test
    void providerOverBudgetIsLeftOut() {
        properties.getBudget().getProviderDailyUsd().put("serpapi", 0.001);
        build();

        PipelineResponse response = service.run(SearchRequest.of("budget limited", 5));

        assertThat(serpapi.calls()).isZero();
        assertThat(response.sources()).isNotEmpty().allSatisfy(url -> assertThat(url).isIn((Object[]) BRAVE_URLS));
        assertThat(costTracker.recordsFor(response.fingerprint())).extracting(CostRecord::provider).doesNotContain("serpapi");
    }

    @Test
    void sourcesCanBeOmitted() {
        build();

        PipelineResponse response = service.run(new SearchRequest("no sources please", 5, false));

        assertThat(response.sources()).isEmpty();
        assertThat(response.answer()).isNotBlank();
    }

    @Test
    void invalidRequestsAreRejectedBeforeAnyWork() {
        build();

        assertThatThrownBy(() -> service.run(new SearchRequest("", 5, true))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.run(new SearchRequest("q", 50, true))).isInstanceOf(ValidationException.class);
        assertThat(brave.calls()).isZero();
        assertThat(service.stats().failures()).isEqualTo(2);
    }

    @Test
    void healthReflectsOpenCircuits() {
        build();
        service.run(SearchRequest.of("warm up", 3));
        assertThat(service.health()).containsEntry("search_providers", "healthy").containsEntry("search:brave", "healthy");

        for (int i = 0; i < 5; i++) {
            breakerRegistry.forDependency("search:brave").onFailure();
        }

        Map<String, String> health = service.health();
        assertThat(health).containsEntry("overall", "degraded").containsEntry("search:brave", "degraded");
    }

    @Test
    void clearedCacheForcesFreshExecution() {
        build();
        service.run(SearchRequest.of("clear me", 3));

        service.clearCache();
        PipelineResponse again = service.run(SearchRequest.of("clear me", 3));

        assertThat(again.cached()).isFalse();
        assertThat(service.stats().executions()).isEqualTo(2);
    }

    @Test
    void mergeQueriesPutsRawQueryFirstAndCaps() {
        List<String> merged = SearchPipelineService.mergeQueries(
                "AI trends", List.of("ai  TRENDS", "what is AI trends", "", "AI trends explained", "AI trends 2024"), 3);

        assertThat(merged).containsExactly("AI trends", "what is AI trends", "AI trends explained");
    }

    private void build() {
        properties.getTimeouts().setRequestMs(requestMs);
        breakerRegistry = new CircuitBreakerRegistry(BreakerSettings.defaults(), clock);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        AuditSink sink = new AuditSink() {
            @Override
            public void appendResponse(PipelineResponse response) {
                audited.add(response);
            }

            @Override
            public void appendCost(CostRecord record) {
            }
        };
        costTracker = new CostTracker(properties.getBudget(), clock, sink, meterRegistry);
        DependencyGuard guard = new DependencyGuard(breakerRegistry, costTracker, dependencyExecutor, meterRegistry);
        TieredCacheService cache = new TieredCacheService(
                new InMemoryCacheTier(200, clock), null, Runnable::run, objectMapper, Map.of(), meterRegistry);
        SearchAggregator aggregator = new SearchAggregator(List.of(brave, serpapi), guard, cache, 10, 2000);
        FetchCoordinator coordinator = new FetchCoordinator(fetcher, guard, cache, 4, 5000, 2000, meterRegistry);
        service = new SearchPipelineService(
                new RuleBasedQueryEnhancer(clock),
                aggregator,
                coordinator,
                synthesizer,
                guard,
                cache,
                breakerRegistry,
                costTracker,
                sink,
                pipelineExecutor,
                properties,
                clock,
                meterRegistry
        );
    }

    private static void awaitInterrupted(StubSearchProvider provider) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (provider.interruptions() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(provider.interruptions()).isPositive();
    }

    private void waitForJoins(long expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (service.stats().singleFlightJoins() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(service.stats().singleFlightJoins()).isEqualTo(expected);
    }
}
