package com.answer.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record PipelineResponse(
        @JsonProperty("query") String query,
        @JsonProperty("answer") String answer,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("processing_time") double processingTime,
        @JsonProperty("cached") boolean cached,
        @JsonProperty("cost_estimate") double costEstimate,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("fingerprint") String fingerprint
) {
    public PipelineResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public PipelineResponse asCached(double lookupSeconds) {
        return new PipelineResponse(query, answer, sources, confidence, lookupSeconds, true,
                costEstimate, timestamp, degraded, fingerprint);
    }
}
