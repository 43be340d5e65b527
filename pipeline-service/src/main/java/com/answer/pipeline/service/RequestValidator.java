package com.answer.pipeline.service;

import com.answer.pipeline.exception.ValidationException;
import com.answer.pipeline.model.SearchRequest;

public final class RequestValidator {

    public static final int MAX_QUERY_LENGTH = 500;
    public static final int MIN_RESULTS = 1;
    public static final int MAX_RESULTS = 20;

    private RequestValidator() {
    }

    /**
     * Returns the request with defaults applied, or throws {@link ValidationException}.
     */
    public static SearchRequest validate(SearchRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        SearchRequest normalised = request.withDefaults();
        if (normalised.query() == null || normalised.query().isEmpty()) {
            throw new ValidationException("query must not be empty");
        }
        if (normalised.query().length() > MAX_QUERY_LENGTH) {
            throw new ValidationException("query must be at most " + MAX_QUERY_LENGTH + " characters");
        }
        int maxResults = normalised.effectiveMaxResults();
        if (maxResults < MIN_RESULTS || maxResults > MAX_RESULTS) {
            throw new ValidationException("max_results must be between " + MIN_RESULTS + " and " + MAX_RESULTS);
        }
        return normalised;
    }
}
