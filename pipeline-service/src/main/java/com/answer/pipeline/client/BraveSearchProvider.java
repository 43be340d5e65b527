package com.answer.pipeline.client;

import com.answer.pipeline.model.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class BraveSearchProvider implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(BraveSearchProvider.class);
    static final int MAX_COUNT = 20;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final double costPerCall;
    private final long requestTimeoutMs;

    public BraveSearchProvider(String baseUrl, String apiKey, double costPerCall, long requestTimeoutMs, ObjectMapper objectMapper) {
        this(WebClient.builder().baseUrl(baseUrl).build(), apiKey, costPerCall, requestTimeoutMs, objectMapper);
    }

    public BraveSearchProvider(WebClient webClient, String apiKey, double costPerCall, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.costPerCall = costPerCall;
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "brave";
    }

    @Override
    public double costPerCall() {
        return costPerCall;
    }

    @Override
    public List<SearchHit> search(String query, int limit) {
        String body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/res/v1/web/search")
                            .queryParam("q", "{q}")
                            .queryParam("count", Math.min(Math.max(1, limit), MAX_COUNT))
                            .queryParam("search_lang", "en")
                            .queryParam("country", "US")
                            .queryParam("safesearch", "moderate")
                            .build(query))
                    .accept(MediaType.APPLICATION_JSON)
                    .header("X-Subscription-Token", apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
        } catch (RuntimeException ex) {
            throw HttpFailures.translate(name(), ex);
        }
        List<SearchHit> hits = parse(body, limit);
        log.debug("brave returned {} hits", hits.size());
        return hits;
    }

    List<SearchHit> parse(String body, int limit) {
        List<SearchHit> hits = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return hits;
        }
        try {
            JsonNode results = objectMapper.readTree(body).path("web").path("results");
            if (!results.isArray()) {
                return hits;
            }
            int rank = 1;
            for (JsonNode item : results) {
                String url = item.path("url").asText("");
                if (url.isBlank()) {
                    continue;
                }
                hits.add(new SearchHit(url, item.path("title").asText(""), item.path("description").asText(""), name(), rank++));
                if (hits.size() >= limit) {
                    break;
                }
            }
            return hits;
        } catch (Exception ex) {
            throw HttpFailures.translate(name(), ex);
        }
    }
}
