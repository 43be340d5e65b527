package com.answer.pipeline.client;

import java.util.List;

public interface QueryEnhancer {

    String name();

    /**
     * Returns alternative formulations of {@code query}. May be empty and may repeat the
     * input.
     */
    List<String> enhance(String query);
}
