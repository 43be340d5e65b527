package com.answer.pipeline.config;

import com.answer.pipeline.audit.AuditSink;
import com.answer.pipeline.audit.JdbcAuditSink;
import com.answer.pipeline.cache.CacheCategory;
import com.answer.pipeline.cache.InMemoryCacheTier;
import com.answer.pipeline.cache.RemoteCacheTier;
import com.answer.pipeline.cache.TieredCacheService;
import com.answer.pipeline.client.AnswerSynthesizer;
import com.answer.pipeline.client.BraveSearchProvider;
import com.answer.pipeline.client.ContentFetcher;
import com.answer.pipeline.client.OllamaAnswerSynthesizer;
import com.answer.pipeline.client.SearchProvider;
import com.answer.pipeline.client.SerpApiSearchProvider;
import com.answer.pipeline.client.ZenRowsContentFetcher;
import com.answer.pipeline.cost.CostTracker;
import com.answer.pipeline.resilience.BreakerSettings;
import com.answer.pipeline.resilience.CircuitBreakerRegistry;
import com.answer.pipeline.service.DependencyGuard;
import com.answer.pipeline.service.FetchCoordinator;
import com.answer.pipeline.service.SearchAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExecutorService pipelineExecutor(PipelineProperties properties) {
        int threads = Math.max(1, properties.getExecutors().getPipelineThreads());
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(threads * 16), namedThreads("pipeline-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    public ExecutorService dependencyExecutor(PipelineProperties properties) {
        int threads = Math.max(1, properties.getExecutors().getDependencyThreads());
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(threads * 32), namedThreads("dependency-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Shared-cache writes and audit inserts. Work beyond the queue is dropped by the callers.
     */
    @Bean
    public ExecutorService backgroundExecutor(PipelineProperties properties) {
        int threads = Math.max(1, properties.getExecutors().getCacheWriteThreads());
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1_000), namedThreads("background-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public TieredCacheService tieredCacheService(
            PipelineProperties properties,
            Clock clock,
            ObjectMapper objectMapper,
            @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor,
            MeterRegistry meterRegistry
    ) {
        PipelineProperties.Cache cache = properties.getCache();
        Map<CacheCategory, Duration> ttls = new EnumMap<>(CacheCategory.class);
        ttls.put(CacheCategory.ENHANCEMENT, Duration.ofSeconds(cache.getEnhancementTtlSeconds()));
        ttls.put(CacheCategory.SEARCH, Duration.ofSeconds(cache.getSearchTtlSeconds()));
        ttls.put(CacheCategory.RESPONSE, Duration.ofSeconds(cache.getResponseTtlSeconds()));
        ttls.put(CacheCategory.CONTENT, Duration.ofSeconds(cache.getContentTtlSeconds()));
        RemoteCacheTier shared = cache.isSharedEnabled()
                ? new RemoteCacheTier(cache.getSharedUrl(), cache.getSharedTimeoutMs())
                : null;
        log.info("event=cache_configured memory_max_entries={} shared_enabled={}",
                cache.getMemoryMaxEntries(), cache.isSharedEnabled());
        return new TieredCacheService(
                new InMemoryCacheTier(cache.getMemoryMaxEntries(), clock),
                shared,
                backgroundExecutor,
                objectMapper,
                ttls,
                meterRegistry
        );
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(PipelineProperties properties, Clock clock) {
        PipelineProperties.Breaker breaker = properties.getBreaker();
        BreakerSettings settings = new BreakerSettings(
                breaker.getFailureThreshold(),
                Duration.ofMillis(breaker.getFailureWindowMs()),
                Duration.ofMillis(breaker.getOpenDurationMs()),
                breaker.getBackoffMultiplier(),
                Duration.ofMillis(breaker.getMaxOpenDurationMs())
        );
        return new CircuitBreakerRegistry(settings, clock);
    }

    @Bean
    public AuditSink auditSink(
            @Value("${pipeline.audit.enabled:true}") boolean enabled,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            @Qualifier("backgroundExecutor") ExecutorService backgroundExecutor
    ) {
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (!enabled || template == null) {
            log.info("event=audit_disabled");
            return AuditSink.noop();
        }
        return new JdbcAuditSink(template, backgroundExecutor);
    }

    @Bean
    public CostTracker costTracker(PipelineProperties properties, Clock clock, AuditSink auditSink, MeterRegistry meterRegistry) {
        return new CostTracker(properties.getBudget(), clock, auditSink, meterRegistry);
    }

    @Bean
    public DependencyGuard dependencyGuard(
            CircuitBreakerRegistry registry,
            CostTracker costTracker,
            @Qualifier("dependencyExecutor") ExecutorService dependencyExecutor,
            MeterRegistry meterRegistry
    ) {
        return new DependencyGuard(registry, costTracker, dependencyExecutor, meterRegistry);
    }

    @Bean
    public List<SearchProvider> searchProviders(
            ObjectMapper objectMapper,
            PipelineProperties properties,
            @Value("${brave.url:https://api.search.brave.com}") String braveUrl,
            @Value("${brave.api-key:}") String braveApiKey,
            @Value("${brave.cost-per-call:0.005}") double braveCost,
            @Value("${serpapi.url:https://serpapi.com}") String serpApiUrl,
            @Value("${serpapi.api-key:}") String serpApiKey,
            @Value("${serpapi.cost-per-call:0.02}") double serpApiCost
    ) {
        long timeoutMs = properties.getTimeouts().getSearchMs();
        List<SearchProvider> providers = new ArrayList<>();
        if (!braveApiKey.isBlank()) {
            providers.add(new BraveSearchProvider(braveUrl, braveApiKey, braveCost, timeoutMs, objectMapper));
        }
        if (!serpApiKey.isBlank()) {
            providers.add(new SerpApiSearchProvider(serpApiUrl, serpApiKey, serpApiCost, timeoutMs, objectMapper));
        }
        if (providers.isEmpty()) {
            log.warn("event=no_search_providers hint=\"set BRAVE_SEARCH_API_KEY or SERPAPI_API_KEY\"");
        } else {
            log.info("event=search_providers_configured count={}", providers.size());
        }
        return providers;
    }

    @Bean
    public ContentFetcher contentFetcher(
            PipelineProperties properties,
            @Value("${zenrows.url:https://api.zenrows.com/v1/}") String zenRowsUrl,
            @Value("${zenrows.api-key:}") String zenRowsApiKey,
            @Value("${zenrows.cost-per-fetch:0.01}") double zenRowsCost
    ) {
        return new ZenRowsContentFetcher(zenRowsUrl, zenRowsApiKey, zenRowsCost,
                properties.getTimeouts().getFetchMs(), properties.getFetch().getMaxContentLength());
    }

    @Bean
    public AnswerSynthesizer answerSynthesizer(
            ObjectMapper objectMapper,
            PipelineProperties properties,
            @Value("${ollama.host:http://localhost:11434}") String ollamaHost,
            @Value("${ollama.model:llama2}") String model,
            @Value("${ollama.temperature:0.7}") double temperature,
            @Value("${ollama.max-tokens:1000}") int maxTokens,
            @Value("${ollama.cost-per-1k-tokens:0.0}") double costPerThousandTokens
    ) {
        return new OllamaAnswerSynthesizer(ollamaHost, model, temperature, maxTokens, costPerThousandTokens,
                properties.getTimeouts().getSynthesizeMs(), objectMapper);
    }

    @Bean
    public SearchAggregator searchAggregator(
            @Qualifier("searchProviders") List<SearchProvider> searchProviders,
            DependencyGuard guard,
            TieredCacheService cache,
            PipelineProperties properties
    ) {
        return new SearchAggregator(searchProviders, guard, cache,
                properties.getSearch().getProviderResultLimit(), properties.getTimeouts().getSearchMs());
    }

    @Bean
    public FetchCoordinator fetchCoordinator(
            ContentFetcher contentFetcher,
            DependencyGuard guard,
            TieredCacheService cache,
            PipelineProperties properties,
            MeterRegistry meterRegistry
    ) {
        return new FetchCoordinator(contentFetcher, guard, cache,
                properties.getFetch().getConcurrency(),
                properties.getFetch().getMaxContentLength(),
                properties.getTimeouts().getFetchMs(),
                meterRegistry);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
