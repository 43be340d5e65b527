package com.answer.pipeline.client;

import com.answer.pipeline.model.FetchedSource;

public interface ContentFetcher {

    String name();

    FetchedSource fetch(String url);

    double costPerFetch();
}
