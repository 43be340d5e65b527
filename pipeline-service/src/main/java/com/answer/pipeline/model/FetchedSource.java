package com.answer.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record FetchedSource(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("extracted_text") String extractedText,
        @JsonProperty("fetch_status") FetchStatus fetchStatus
) {
    public static FetchedSource failed(String url) {
        return new FetchedSource(url, "", "", FetchStatus.FAILED);
    }

    @JsonIgnore
    public boolean isUsable() {
        return fetchStatus != FetchStatus.FAILED && extractedText != null && !extractedText.isBlank();
    }

    /**
     * Returns this source bounded to {@code maxLength} characters, marked TRUNCATED when
     * text had to be cut.
     */
    public FetchedSource bounded(int maxLength) {
        if (extractedText == null || extractedText.length() <= maxLength) {
            return this;
        }
        return new FetchedSource(url, title, extractedText.substring(0, maxLength), FetchStatus.TRUNCATED);
    }
}
