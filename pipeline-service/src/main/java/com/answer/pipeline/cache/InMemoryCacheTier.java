package com.answer.pipeline.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryCacheTier implements CacheTier {

    private final Clock clock;
    private final int maxEntries;
    private final LinkedHashMap<String, CacheEntry> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public InMemoryCacheTier(int maxEntries, Clock clock) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                boolean evict = size() > InMemoryCacheTier.this.maxEntries;
                if (evict) {
                    evictions.incrementAndGet();
                }
                return evict;
            }
        };
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Optional<String> get(String key) {
        Instant now = clock.instant();
        synchronized (entries) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                misses.incrementAndGet();
                return Optional.empty();
            }
            entries.put(key, entry.touch(now));
            hits.incrementAndGet();
            return Optional.of(entry.value());
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, value, now, now.plus(ttl), now);
        synchronized (entries) {
            entries.put(key, entry);
        }
    }

    @Override
    public void evict(String key) {
        synchronized (entries) {
            entries.remove(key);
        }
    }

    @Override
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    // get() would reorder the access-ordered map, so scan instead.
    public Optional<CacheEntry> peek(String key) {
        synchronized (entries) {
            for (CacheEntry entry : entries.values()) {
                if (entry.key().equals(key)) {
                    return Optional.of(entry);
                }
            }
            return Optional.empty();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int capacity() {
        return maxEntries;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }
}
