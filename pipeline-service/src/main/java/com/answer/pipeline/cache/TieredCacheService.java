package com.answer.pipeline.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

public class TieredCacheService {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheService.class);

    private final InMemoryCacheTier memoryTier;
    private final CacheTier sharedTier;
    private final Executor sharedWriteExecutor;
    private final ObjectMapper objectMapper;
    private final Map<CacheCategory, Duration> ttls;
    private final MeterRegistry meterRegistry;

    public TieredCacheService(
            InMemoryCacheTier memoryTier,
            CacheTier sharedTier,
            Executor sharedWriteExecutor,
            ObjectMapper objectMapper,
            Map<CacheCategory, Duration> ttls,
            MeterRegistry meterRegistry
    ) {
        this.memoryTier = memoryTier;
        this.sharedTier = sharedTier;
        this.sharedWriteExecutor = sharedWriteExecutor;
        this.objectMapper = objectMapper;
        this.ttls = new EnumMap<>(CacheCategory.class);
        this.ttls.putAll(ttls);
        this.meterRegistry = meterRegistry;
    }

    public <T> Optional<T> get(String key, CacheCategory category, Class<T> type) {
        return get(key, category, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(String key, CacheCategory category, TypeReference<T> type) {
        return get(key, category, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> Optional<T> get(String key, CacheCategory category, JavaType type) {
        String fullKey = fullKey(key, category);
        Optional<String> payload = memoryTier.get(fullKey);
        String layer = "memory";
        if (payload.isEmpty() && sharedTier != null) {
            payload = sharedTier.get(fullKey);
            layer = "shared";
            payload.ifPresent(value -> memoryTier.put(fullKey, value, ttlFor(category)));
        }
        if (payload.isEmpty()) {
            incrementCounter("pipeline_cache_miss_total", category);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(payload.get(), type);
            incrementCounter("pipeline_cache_hit_total", category);
            log.debug("event=cache_hit layer={} category={} key={}", layer, category.prefix(), key);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException ex) {
            log.warn("event=cache_decode_failed category={} key={} cause={}", category.prefix(), key, ex.getOriginalMessage());
            invalidate(key, category);
            return Optional.empty();
        }
    }

    public void set(String key, Object value, CacheCategory category) {
        if (value == null) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("event=cache_encode_failed category={} key={} cause={}", category.prefix(), key, ex.getOriginalMessage());
            return;
        }
        String fullKey = fullKey(key, category);
        Duration ttl = ttlFor(category);
        memoryTier.put(fullKey, payload, ttl);
        if (sharedTier == null) {
            return;
        }
        try {
            sharedWriteExecutor.execute(() -> sharedTier.put(fullKey, payload, ttl));
        } catch (RejectedExecutionException ex) {
            log.debug("shared cache write dropped key={} cause={}", fullKey, ex.getMessage());
        }
    }

    /**
     * Removes {@code key} under every category from both tiers.
     */
    public void invalidate(String key) {
        for (CacheCategory category : CacheCategory.values()) {
            invalidate(key, category);
        }
    }

    public void invalidate(String key, CacheCategory category) {
        String fullKey = fullKey(key, category);
        memoryTier.evict(fullKey);
        if (sharedTier != null) {
            sharedTier.evict(fullKey);
        }
    }

    public void clear() {
        memoryTier.clear();
        if (sharedTier != null) {
            sharedTier.clear();
        }
        log.info("event=cache_cleared");
    }

    public Duration ttlFor(CacheCategory category) {
        return ttls.getOrDefault(category, Duration.ofHours(1));
    }

    public CacheStats stats() {
        RemoteCacheTier remote = sharedTier instanceof RemoteCacheTier ? (RemoteCacheTier) sharedTier : null;
        return new CacheStats(
                memoryTier.size(),
                memoryTier.capacity(),
                memoryTier.hits(),
                memoryTier.misses(),
                memoryTier.evictions(),
                remote == null ? 0L : remote.hits(),
                remote == null ? 0L : remote.misses(),
                sharedTier != null,
                remote == null ? sharedTier != null : remote.isAvailable()
        );
    }

    /**
     * Status string used by the health report.
     */
    public String health() {
        if (sharedTier == null) {
            return "memory_only";
        }
        if (sharedTier instanceof RemoteCacheTier && !((RemoteCacheTier) sharedTier).isAvailable()) {
            return "memory_only";
        }
        return "healthy";
    }

    private static String fullKey(String key, CacheCategory category) {
        return category.prefix() + ":" + key;
    }

    private void incrementCounter(String metricName, CacheCategory category) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "category", category.prefix()).increment();
    }
}
