package com.answer.pipeline.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * One storage tier holding serialized values. Implementations must be safe for concurrent
 * use and must report backend errors as misses rather than throwing.
 */
public interface CacheTier {

    String name();

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void evict(String key);

    void clear();
}
