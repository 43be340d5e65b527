package com.answer.pipeline.cache;

import java.time.Instant;

public record CacheEntry(String key, String value, Instant createdAt, Instant expiresAt, Instant lastAccessed) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CacheEntry touch(Instant now) {
        return new CacheEntry(key, value, createdAt, expiresAt, now);
    }
}
