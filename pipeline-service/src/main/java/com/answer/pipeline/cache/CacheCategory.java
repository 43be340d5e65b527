package com.answer.pipeline.cache;

import java.util.Locale;

/**
 * TTL class of a cached value. The lower-case name doubles as the key namespace.
 */
public enum CacheCategory {
    ENHANCEMENT,
    SEARCH,
    RESPONSE,
    CONTENT;

    public String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
