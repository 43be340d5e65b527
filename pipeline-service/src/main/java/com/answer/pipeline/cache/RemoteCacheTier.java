package com.answer.pipeline.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public class RemoteCacheTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(RemoteCacheTier.class);

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicBoolean available = new AtomicBoolean(true);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public RemoteCacheTier(String cachingUrl, long requestTimeoutMs) {
        this(WebClient.builder().baseUrl(cachingUrl).build(), requestTimeoutMs);
    }

    public RemoteCacheTier(WebClient webClient, long requestTimeoutMs) {
        this.webClient = webClient;
        this.requestTimeout = Duration.ofMillis(Math.max(20L, requestTimeoutMs));
    }

    @Override
    public String name() {
        return "shared";
    }

    @Override
    public Optional<String> get(String key) {
        try {
            String response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/get")
                            .queryParam("key", key)
                            .build())
                    .exchangeToMono(clientResponse -> clientResponse.statusCode().is2xxSuccessful()
                            ? clientResponse.bodyToMono(String.class)
                            : Mono.empty())
                    .block(requestTimeout);
            available.set(true);
            if (response == null || response.isBlank()) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(response);
        } catch (Exception ex) {
            markUnavailable("get", ex);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/put")
                            .queryParam("key", key)
                            .queryParam("ttl", Math.max(1L, ttl.toSeconds()))
                            .build())
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue(value)
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout);
            available.set(true);
        } catch (Exception ex) {
            markUnavailable("put", ex);
        }
    }

    @Override
    public void evict(String key) {
        try {
            webClient.delete()
                    .uri(uriBuilder -> uriBuilder
                            .path("/cache/evict")
                            .queryParam("key", key)
                            .build())
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout);
            available.set(true);
        } catch (Exception ex) {
            markUnavailable("evict", ex);
        }
    }

    @Override
    public void clear() {
        try {
            webClient.delete()
                    .uri("/cache/clear")
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout);
            available.set(true);
        } catch (Exception ex) {
            markUnavailable("clear", ex);
        }
    }

    public boolean isAvailable() {
        return available.get();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private void markUnavailable(String operation, Exception ex) {
        if (available.getAndSet(false)) {
            log.warn("event=shared_cache_unavailable op={} cause={}", operation, ex.toString());
        } else {
            log.debug("shared cache {} failed: {}", operation, ex.getMessage());
        }
    }
}
