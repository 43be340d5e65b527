package com.answer.pipeline.client;

import com.answer.pipeline.model.SearchHit;

import java.util.List;

/**
 * A web search backend. Failures are reported as
 * {@link com.answer.pipeline.exception.DependencyFailureException}.
 */
public interface SearchProvider {

    String name();

    List<SearchHit> search(String query, int limit);

    /**
     * Price of one {@link #search} call in USD.
     */
    double costPerCall();
}
