package com.answer.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound query. {@code maxResults} and {@code includeSources} may be null on the wire;
 * {@link #withDefaults()} fills them before the request enters the pipeline.
 */
public record SearchRequest(
        @JsonProperty("query") String query,
        @JsonProperty("max_results") Integer maxResults,
        @JsonProperty("include_sources") Boolean includeSources
) {
    public static final int DEFAULT_MAX_RESULTS = 8;

    public static SearchRequest of(String query) {
        return new SearchRequest(query, DEFAULT_MAX_RESULTS, true);
    }

    public static SearchRequest of(String query, int maxResults) {
        return new SearchRequest(query, maxResults, true);
    }

    public SearchRequest withDefaults() {
        return new SearchRequest(
                query == null ? null : query.trim(),
                maxResults == null ? DEFAULT_MAX_RESULTS : maxResults,
                includeSources == null ? Boolean.TRUE : includeSources
        );
    }

    public int effectiveMaxResults() {
        return maxResults == null ? DEFAULT_MAX_RESULTS : maxResults;
    }

    public boolean effectiveIncludeSources() {
        return includeSources == null || includeSources;
    }
}
