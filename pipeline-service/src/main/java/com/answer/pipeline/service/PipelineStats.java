package com.answer.pipeline.service;

import com.answer.pipeline.cache.CacheStats;
import com.answer.pipeline.cost.CostSummary;
import com.answer.pipeline.resilience.CircuitSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PipelineStats(
        @JsonProperty("requests") long requests,
        @JsonProperty("cache_hits") long cacheHits,
        @JsonProperty("executions") long executions,
        @JsonProperty("single_flight_joins") long singleFlightJoins,
        @JsonProperty("degraded_responses") long degradedResponses,
        @JsonProperty("failures") long failures,
        @JsonProperty("in_flight") int inFlight,
        @JsonProperty("circuits") List<CircuitSnapshot> circuits,
        @JsonProperty("costs") CostSummary costs,
        @JsonProperty("cache") CacheStats cache
) {
}
