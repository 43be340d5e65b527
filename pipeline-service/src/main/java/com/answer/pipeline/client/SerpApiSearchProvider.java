package com.answer.pipeline.client;

import com.answer.pipeline.model.SearchHit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class SerpApiSearchProvider implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(SerpApiSearchProvider.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final double costPerCall;
    private final long requestTimeoutMs;

    public SerpApiSearchProvider(String baseUrl, String apiKey, double costPerCall, long requestTimeoutMs, ObjectMapper objectMapper) {
        this(WebClient.builder().baseUrl(baseUrl).build(), apiKey, costPerCall, requestTimeoutMs, objectMapper);
    }

    public SerpApiSearchProvider(WebClient webClient, String apiKey, double costPerCall, long requestTimeoutMs, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.costPerCall = costPerCall;
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "serpapi";
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
                            .path("/search")
                            .queryParam("q", "{q}")
                            .queryParam("api_key", "{key}")
                            .queryParam("engine", "google")
                            .queryParam("num", Math.min(Math.max(1, limit), 20))
                            .queryParam("hl", "en")
                            .queryParam("gl", "us")
                            .queryParam("output", "json")
                            .build(query, apiKey))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
        } catch (RuntimeException ex) {
            throw HttpFailures.translate(name(), ex);
        }
        List<SearchHit> hits = parse(body, limit);
        log.debug("serpapi returned {} hits", hits.size());
        return hits;
    }

    List<SearchHit> parse(String body, int limit) {
        List<SearchHit> hits = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return hits;
        }
        try {
            JsonNode results = objectMapper.readTree(body).path("organic_results");
            if (!results.isArray()) {
                return hits;
            }
            int fallbackRank = 1;
            for (JsonNode item : results) {
                String url = item.path("link").asText("");
                if (url.isBlank()) {
                    continue;
                }
                int rank = item.path("position").asInt(fallbackRank);
                hits.add(new SearchHit(url, item.path("title").asText(""), item.path("snippet").asText(""), name(), rank));
                fallbackRank++;
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
