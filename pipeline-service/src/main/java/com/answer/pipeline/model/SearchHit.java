package com.answer.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SearchHit(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("snippet") String snippet,
        @JsonProperty("provider") String provider,
        @JsonProperty("rank") int rank
) {
    public SearchHit withUrl(String canonicalUrl) {
        return new SearchHit(canonicalUrl, title, snippet, provider, rank);
    }
}
