package com.answer.pipeline.service;

import com.answer.pipeline.cache.CacheCategory;
import com.answer.pipeline.cache.TieredCacheService;
import com.answer.pipeline.client.SearchProvider;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.RequestFingerprint;
import com.answer.pipeline.model.SearchHit;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

public class SearchAggregator {

    private static final Logger log = LoggerFactory.getLogger(SearchAggregator.class);
    private static final TypeReference<List<SearchHit>> HIT_LIST = new TypeReference<>() {
    };
    static final int RRF_K = 60;

    private final List<SearchProvider> providers;
    private final DependencyGuard guard;
    private final TieredCacheService cache;
    private final int providerResultLimit;
    private final long searchTimeoutMs;

    public SearchAggregator(
            List<SearchProvider> providers,
            DependencyGuard guard,
            TieredCacheService cache,
            int providerResultLimit,
            long searchTimeoutMs
    ) {
        this.providers = List.copyOf(providers);
        this.guard = guard;
        this.cache = cache;
        this.providerResultLimit = Math.max(1, providerResultLimit);
        this.searchTimeoutMs = searchTimeoutMs;
    }

    public List<String> providerNames() {
        return providers.stream().map(SearchProvider::name).collect(Collectors.toList());
    }

    /**
     * Returns every hit found for {@code queries}, canonicalised but not yet fused. FAILED
     * only when no query was answered by the cache or by at least one provider.
     */
    public StageResult<List<SearchHit>> search(List<String> queries, int maxResults, RunContext context) {
        if (providers.isEmpty()) {
            return StageResult.failed(FailureKind.ERROR, "no search providers configured");
        }
        int limit = Math.max(providerResultLimit, maxResults);
        List<SearchHit> collected = new ArrayList<>();
        Map<String, List<CompletableFuture<StageResult<List<SearchHit>>>>> pending = new LinkedHashMap<>();
        int answered = 0;

        for (String query : queries) {
            Optional<List<SearchHit>> cached = cache.get(cacheKey(query, limit), CacheCategory.SEARCH, HIT_LIST);
            if (cached.isPresent()) {
                collected.addAll(cached.get());
                answered++;
                continue;
            }
            List<CompletableFuture<StageResult<List<SearchHit>>>> calls = new ArrayList<>();
            for (SearchProvider provider : providers) {
                DependencyGuard.Call<List<SearchHit>> call = DependencyGuard.Call.metered(
                        "search:" + provider.name(),
                        provider.name(),
                        provider.costPerCall(),
                        Duration.ofMillis(searchTimeoutMs),
                        () -> provider.search(query, limit)
                );
                calls.add(guard.submit(call, context));
            }
            pending.put(query, calls);
        }

        int failedCalls = 0;
        for (Map.Entry<String, List<CompletableFuture<StageResult<List<SearchHit>>>>> entry : pending.entrySet()) {
            List<SearchHit> union = new ArrayList<>();
            boolean anySuccess = false;
            for (CompletableFuture<StageResult<List<SearchHit>>> future : entry.getValue()) {
                StageResult<List<SearchHit>> result = future.join();
                if (result.isFailed()) {
                    failedCalls++;
                    continue;
                }
                anySuccess = true;
                union.addAll(canonicalise(result.value()));
            }
            if (anySuccess) {
                answered++;
                collected.addAll(union);
                cache.set(cacheKey(entry.getKey(), limit), union, CacheCategory.SEARCH);
            }
        }

        log.info("trace_id={} stage=search queries={} answered={} failed_calls={} hits={}",
                context.traceId(), queries.size(), answered, failedCalls, collected.size());
        if (answered == 0) {
            return StageResult.failed(FailureKind.ERROR, "all search providers failed");
        }
        return failedCalls == 0 ? StageResult.success(collected) : StageResult.degraded(collected, failedCalls + " provider calls failed");
    }

    /**
     * Reciprocal-rank fusion over every (query, provider) list the hits came from. Each URL
     * appears once; ties fall back to the best provider rank, then to the URL.
     */
    public static List<SearchHit> mergeAndRank(List<SearchHit> hits, int maxResults) {
        Map<String, Fused> byUrl = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            if (hit.url() == null || hit.url().isBlank()) {
                continue;
            }
            String url = canonicalUrl(hit.url());
            Fused fused = byUrl.computeIfAbsent(url, ignored -> new Fused(hit.withUrl(url)));
            fused.add(hit);
        }
        return byUrl.values().stream()
                .sorted(Comparator.comparingDouble(Fused::score).reversed()
                        .thenComparingInt(Fused::bestRank)
                        .thenComparing(fused -> fused.best.url()))
                .limit(Math.max(0, maxResults))
                .map(fused -> fused.best)
                .collect(Collectors.toList());
    }

    /**
     * Lower-cases scheme and host and drops the fragment and trailing slashes. Unparseable
     * input is only trimmed.
     */
    public static String canonicalUrl(String raw) {
        String trimmed = raw.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return stripTrailingSlash(stripFragment(trimmed));
            }
            StringBuilder canonical = new StringBuilder()
                    .append(uri.getScheme().toLowerCase(Locale.ROOT))
                    .append("://");
            if (uri.getRawUserInfo() != null) {
                canonical.append(uri.getRawUserInfo()).append('@');
            }
            canonical.append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1) {
                canonical.append(':').append(uri.getPort());
            }
            canonical.append(stripTrailingSlash(uri.getRawPath() == null ? "" : uri.getRawPath()));
            if (uri.getRawQuery() != null) {
                canonical.append('?').append(uri.getRawQuery());
            }
            return canonical.toString();
        } catch (URISyntaxException ex) {
            return stripTrailingSlash(stripFragment(trimmed));
        }
    }

    private List<SearchHit> canonicalise(List<SearchHit> hits) {
        if (hits == null) {
            return List.of();
        }
        List<SearchHit> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (SearchHit hit : hits) {
            if (hit == null || hit.url() == null || hit.url().isBlank()) {
                continue;
            }
            String url = canonicalUrl(hit.url());
            if (seen.add(url)) {
                result.add(hit.withUrl(url));
            }
        }
        return result;
    }

    static String cacheKey(String query, int limit) {
        return RequestFingerprint.sha256(RequestFingerprint.normalizeQuery(query) + "|limit=" + limit);
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static final class Fused {
        private SearchHit best;
        private double score;

        private Fused(SearchHit first) {
            this.best = first;
        }

        private void add(SearchHit hit) {
            int rank = Math.max(1, hit.rank());
            score += 1.0 / (RRF_K + rank);
            if (rank < best.rank()) {
                best = hit.withUrl(best.url());
            }
        }

        private double score() {
            return score;
        }

        private int bestRank() {
            return best.rank();
        }
    }
}
