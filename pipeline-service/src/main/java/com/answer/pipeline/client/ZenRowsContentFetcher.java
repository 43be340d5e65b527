package com.answer.pipeline.client;

import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.FetchStatus;
import com.answer.pipeline.model.FetchedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

public class ZenRowsContentFetcher implements ContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(ZenRowsContentFetcher.class);
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; answer-engine/1.0)";

    private final WebClient zenRowsClient;
    private final WebClient directClient;
    private final String apiKey;
    private final double costPerFetch;
    private final long requestTimeoutMs;
    private final int maxContentLength;
    private final HtmlContentExtractor extractor;

    public ZenRowsContentFetcher(String zenRowsUrl, String apiKey, double costPerFetch, long requestTimeoutMs, int maxContentLength) {
        this(
                WebClient.builder().baseUrl(zenRowsUrl).build(),
                WebClient.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                        .build(),
                apiKey,
                costPerFetch,
                requestTimeoutMs,
                maxContentLength,
                new HtmlContentExtractor()
        );
    }

    public ZenRowsContentFetcher(
            WebClient zenRowsClient,
            WebClient directClient,
            String apiKey,
            double costPerFetch,
            long requestTimeoutMs,
            int maxContentLength,
            HtmlContentExtractor extractor
    ) {
        this.zenRowsClient = zenRowsClient;
        this.directClient = directClient;
        this.apiKey = apiKey;
        this.costPerFetch = costPerFetch;
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.maxContentLength = Math.max(1, maxContentLength);
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "zenrows";
    }

    /**
     * Direct fetches are free.
     */
    @Override
    public double costPerFetch() {
        return usesProxy() ? costPerFetch : 0.0;
    }

    @Override
    public FetchedSource fetch(String url) {
        String html = null;
        if (usesProxy()) {
            try {
                html = viaProxy(url);
            } catch (RuntimeException ex) {
                log.debug("zenrows fetch failed url={} cause={}", url, ex.getMessage());
            }
        }
        if (html == null || html.isBlank()) {
            try {
                html = direct(url);
            } catch (RuntimeException ex) {
                throw HttpFailures.translate(name(), ex);
            }
        }
        HtmlContentExtractor.Extracted extracted = extractor.extract(html, url);
        if (extracted.text().isBlank()) {
            throw new DependencyFailureException(name(), FailureKind.ERROR, "no extractable content at " + url);
        }
        return new FetchedSource(url, extracted.title(), extracted.text(), FetchStatus.OK).bounded(maxContentLength);
    }

    private boolean usesProxy() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String viaProxy(String url) {
        return zenRowsClient.get()
                .uri(uriBuilder -> uriBuilder
                        .queryParam("url", "{url}")
                        .queryParam("apikey", apiKey)
                        .queryParam("js_render", "true")
                        .queryParam("premium_proxy", "true")
                        .queryParam("proxy_country", "US")
                        .build(url))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
    }

    private String direct(String url) {
        return directClient.get()
                .uri(URI.create(url))
                .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5")
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofMillis(requestTimeoutMs));
    }
}
