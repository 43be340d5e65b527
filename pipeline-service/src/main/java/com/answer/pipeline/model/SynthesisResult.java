package com.answer.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SynthesisResult(
        @JsonProperty("answer_text") String answerText,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("sources_used") List<String> sourcesUsed,
        @JsonProperty("tokens_used") int tokensUsed
) {
    public SynthesisResult {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
    }
}
