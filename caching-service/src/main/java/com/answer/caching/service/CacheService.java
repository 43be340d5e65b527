package com.answer.caching.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class CacheService {

    private static final Logger log = LoggerFactory.getLogger(CacheService.class);
    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final MeterRegistry meterRegistry;
    private final long maxTtlSeconds;
    private final String keyPrefix;

    public CacheService(
            StringRedisTemplate redisTemplate,
            MeterRegistry meterRegistry,
            @Value("${cache.max-ttl-seconds:86400}") long maxTtlSeconds,
            @Value("${cache.key-prefix:answer:}") String keyPrefix
    ) {
        this.redisTemplate = redisTemplate;
        this.meterRegistry = meterRegistry;
        this.maxTtlSeconds = Math.max(1L, maxTtlSeconds);
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    public void put(String key, String value, long ttlSeconds) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        long effectiveTtl = Math.min(Math.max(1L, ttlSeconds), maxTtlSeconds);
        redisTemplate.opsForValue().set(keyPrefix + key, value, effectiveTtl, TimeUnit.SECONDS);
        meterRegistry.counter("cache_put_count_total").increment();
    }

    public String get(String key) {
        requireKey(key);
        String value = redisTemplate.opsForValue().get(keyPrefix + key);
        if (value == null) {
            meterRegistry.counter("cache_miss_count_total").increment();
        } else {
            meterRegistry.counter("cache_hit_count_total").increment();
        }
        return value;
    }

    public boolean evict(String key) {
        requireKey(key);
        return Boolean.TRUE.equals(redisTemplate.delete(keyPrefix + key));
    }

    public long clear(String pattern) {
        String match = escapeGlob(keyPrefix) + (pattern == null || pattern.isBlank() ? "*" : "*" + escapeGlob(pattern) + "*");
        ScanOptions options = ScanOptions.scanOptions().match(match).count(SCAN_BATCH).build();
        long removed = 0L;
        List<String> batch = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteBatch(batch);
                    batch.clear();
                }
            }
        }
        removed += deleteBatch(batch);
        log.info("event=cache_clear pattern=\"{}\" removed={}", match, removed);
        return removed;
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        Long removed = redisTemplate.delete(keys);
        return removed == null ? 0L : removed;
    }

    static String escapeGlob(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
