package com.answer.pipeline.client;

import com.answer.pipeline.exception.DependencyFailureException;
import com.answer.pipeline.exception.FailureKind;
import com.answer.pipeline.model.FetchedSource;
import com.answer.pipeline.model.SynthesisResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class OllamaAnswerSynthesizer implements AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(OllamaAnswerSynthesizer.class);

    static final int MAX_PROMPT_SOURCES = 5;
    static final int MAX_CHARS_PER_SOURCE = 800;
    static final int MAX_ANSWER_CHARS = 2000;
    static final int MIN_ANSWER_CHARS = 50;

    private static final List<String> ARTIFACT_PREFIXES = List.of(
            "RESPONSE:", "Answer:", "Based on the search results:", "According to the provided information:"
    );
    private static final List<String> GENERIC_INDICATORS = List.of(
            "error", "unable to", "cannot provide", "insufficient information"
    );
    private static final List<String> NAVIGATION_WORDS = List.of("home", "about", "contact", "menu", "navigation");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final double costPerThousandTokens;
    private final long requestTimeoutMs;

    public OllamaAnswerSynthesizer(
            String ollamaHost,
            String model,
            double temperature,
            int maxTokens,
            double costPerThousandTokens,
            long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this(WebClient.builder().baseUrl(ollamaHost).build(), model, temperature, maxTokens,
                costPerThousandTokens, requestTimeoutMs, objectMapper);
    }

    public OllamaAnswerSynthesizer(
            WebClient webClient,
            String model,
            double temperature,
            int maxTokens,
            double costPerThousandTokens,
            long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this.webClient = webClient;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.costPerThousandTokens = Math.max(0.0, costPerThousandTokens);
        this.requestTimeoutMs = Math.max(100L, requestTimeoutMs);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public SynthesisResult synthesize(String query, List<FetchedSource> sources) {
        List<FetchedSource> promptSources = sources.subList(0, Math.min(MAX_PROMPT_SOURCES, sources.size()));
        String prompt = buildPrompt(query, promptSources);

        String raw = generate(prompt);
        if (raw == null || raw.isBlank()) {
            throw new DependencyFailureException("ollama", FailureKind.MODEL_UNAVAILABLE, "model returned an empty response");
        }
        String answer = cleanAnswer(raw);
        double confidence = confidence(answer, promptSources);
        List<String> used = new ArrayList<>();
        for (FetchedSource source : promptSources) {
            used.add(source.url());
        }
        int tokens = estimateTokens(prompt) + estimateTokens(raw);
        log.debug("event=synthesis_done model={} answer_chars={} tokens={}", model, answer.length(), tokens);
        return new SynthesisResult(answer, confidence, used, tokens);
    }

    @Override
    public double estimateCost(String query, List<FetchedSource> sources) {
        List<FetchedSource> promptSources = sources.subList(0, Math.min(MAX_PROMPT_SOURCES, sources.size()));
        return tokenCost(estimateTokens(buildPrompt(query, promptSources)) + maxTokens);
    }

    @Override
    public double actualCost(SynthesisResult result) {
        return tokenCost(result.tokensUsed());
    }

    private String generate(String prompt) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", temperature);
        options.put("num_predict", maxTokens);
        options.put("top_p", 0.9);
        options.put("top_k", 40);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("prompt", prompt);
        payload.put("stream", false);
        payload.put("options", options);

        String body;
        try {
            body = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(requestTimeoutMs));
        } catch (RuntimeException ex) {
            DependencyFailureException failure = HttpFailures.translate("ollama", ex);
            if (failure.getFailureKind() == FailureKind.NOT_FOUND || failure.getFailureKind() == FailureKind.ERROR) {
                throw new DependencyFailureException("ollama", FailureKind.MODEL_UNAVAILABLE, failure.getMessage(), ex);
            }
            throw failure;
        }
        try {
            JsonNode root = objectMapper.readTree(body == null ? "{}" : body);
            return root.path("response").asText("").trim();
        } catch (Exception ex) {
            throw new DependencyFailureException("ollama", FailureKind.ERROR, "unreadable model response", ex);
        }
    }

    static String buildPrompt(String query, List<FetchedSource> sources) {
        List<String> sections = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            FetchedSource source = sources.get(i);
            String text = source.extractedText() == null ? "" : source.extractedText();
            String excerpt = text.length() > MAX_CHARS_PER_SOURCE ? text.substring(0, MAX_CHARS_PER_SOURCE) + "..." : text;
            sections.add("Source " + (i + 1) + ":\nTitle: " + source.title() + "\nURL: " + source.url() + "\nContent: " + excerpt + "\n");
        }
        return "You are an AI assistant that provides accurate, helpful responses based on web search results.\n\n"
                + "USER QUERY: " + query + "\n\n"
                + "SEARCH RESULTS:\n" + String.join("\n---\n", sections) + "\n\n"
                + "INSTRUCTIONS:\n"
                + "1. Provide a comprehensive, accurate answer to the user's query based on the search results above\n"
                + "2. Synthesize information from multiple sources when possible\n"
                + "3. Be factual and cite information appropriately\n"
                + "4. If the search results don't fully answer the query, acknowledge what's missing\n"
                + "5. Keep your response focused and relevant to the specific query\n"
                + "6. Aim for 2-4 paragraphs unless a shorter or longer response is more appropriate\n"
                + "7. Use clear, accessible language\n\n"
                + "RESPONSE:";
    }

    static String cleanAnswer(String raw) {
        String cleaned = raw.trim();
        for (String artifact : ARTIFACT_PREFIXES) {
            if (cleaned.startsWith(artifact)) {
                cleaned = cleaned.substring(artifact.length()).trim();
            }
        }
        if (cleaned.length() < MIN_ANSWER_CHARS) {
            throw new DependencyFailureException("ollama", FailureKind.ERROR, "model answer too short to use");
        }
        if (cleaned.length() > MAX_ANSWER_CHARS) {
            cleaned = cleaned.substring(0, MAX_ANSWER_CHARS) + "...";
        }
        return cleaned;
    }

    /**
     * 0.5 base, plus source quality, answer length and domain diversity, minus a penalty for
     * hedging or error-like answers. Clamped to [0, 1].
     */
    static double confidence(String answer, List<FetchedSource> sources) {
        double score = 0.5;
        if (!sources.isEmpty()) {
            double total = 0.0;
            for (FetchedSource source : sources) {
                total += sourceQuality(source);
            }
            score += (total / sources.size()) * 0.3;
        }

        int words = answer.split("\\s+").length;
        if (words >= 50 && words <= 300) {
            score += 0.2;
        } else if (words > 20) {
            score += 0.1;
        }

        Set<String> hosts = new HashSet<>();
        for (FetchedSource source : sources) {
            try {
                String host = URI.create(source.url()).getHost();
                if (host != null) {
                    hosts.add(host.toLowerCase(Locale.ROOT));
                }
            } catch (IllegalArgumentException ex) {
                log.debug("unparseable source url {}", source.url());
            }
        }
        if (hosts.size() > 1) {
            score += 0.1;
        }

        String lower = answer.toLowerCase(Locale.ROOT);
        for (String indicator : GENERIC_INDICATORS) {
            if (lower.contains(indicator)) {
                score -= 0.2;
                break;
            }
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    static double sourceQuality(FetchedSource source) {
        String text = source.extractedText() == null ? "" : source.extractedText();
        double score = 0.5;
        int words = text.isBlank() ? 0 : text.split("\\s+").length;
        if (words > 100) {
            score += 0.2;
        } else if (words > 50) {
            score += 0.1;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (source.title() != null && !source.title().isBlank() && lower.contains(source.title().toLowerCase(Locale.ROOT))) {
            score += 0.1;
        }
        if (text.contains(".") && text.length() > 200) {
            score += 0.1;
        }
        int navigationHits = 0;
        for (String word : NAVIGATION_WORDS) {
            if (lower.contains(word)) {
                navigationHits++;
            }
        }
        if (navigationHits > 3) {
            score -= 0.2;
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    // roughly 1.3 tokens per word
    static int estimateTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return (int) Math.ceil(text.trim().split("\\s+").length * 1.3);
    }

    private double tokenCost(int tokens) {
        return (tokens / 1000.0) * costPerThousandTokens;
    }
}
