package com.answer.pipeline.client;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class RuleBasedQueryEnhancer implements QueryEnhancer {

    private static final List<String> TECH_KEYWORDS = List.of("api", "code", "programming", "software", "algorithm", "tech");
    private static final List<String> BUSINESS_KEYWORDS = List.of("business", "strategy", "market", "company", "revenue");
    private static final List<String> ACADEMIC_KEYWORDS = List.of("research", "study", "analysis", "theory", "academic");
    private static final List<String> HEALTH_KEYWORDS = List.of("health", "medical", "disease", "treatment", "symptoms");
    private static final List<String> TEMPORAL_WORDS = List.of("recent", "latest", "current", "now", "today");
    private static final List<String> TIME_SENSITIVE_KEYWORDS = List.of("trends", "news", "updates", "development", "technology");

    private final Clock clock;

    public RuleBasedQueryEnhancer() {
        this(Clock.systemUTC());
    }

    public RuleBasedQueryEnhancer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "rules";
    }

    @Override
    public List<String> enhance(String query) {
        List<String> variants = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return variants;
        }
        String trimmed = query.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        variants.addAll(semanticVariants(trimmed));
        domainVariant(trimmed, lower).ifPresent(variants::add);
        temporalVariant(trimmed, lower).ifPresent(variants::add);
        return variants;
    }

    private List<String> semanticVariants(String query) {
        List<String> variants = new ArrayList<>();
        if (!query.endsWith("?")) {
            variants.add("what is " + query);
            variants.add(query + " explained");
        }
        String[] words = query.split("\\s+");
        if (variants.size() < 2 && words.length > 1) {
            variants.add(query + " guide");
        }
        return variants.subList(0, Math.min(2, variants.size()));
    }

    private Optional<String> domainVariant(String query, String lower) {
        if (containsAny(lower, TECH_KEYWORDS)) {
            return Optional.of(query + " programming guide");
        }
        if (containsAny(lower, BUSINESS_KEYWORDS)) {
            return Optional.of(query + " analysis");
        }
        if (containsAny(lower, ACADEMIC_KEYWORDS)) {
            return Optional.of(query + " research paper");
        }
        if (containsAny(lower, HEALTH_KEYWORDS)) {
            return Optional.of(query + " medical information");
        }
        return Optional.empty();
    }

    private Optional<String> temporalVariant(String query, String lower) {
        String year = Year.now(clock).toString();
        if (lower.contains(year) || containsAny(lower, TEMPORAL_WORDS)) {
            return Optional.empty();
        }
        if (containsAny(lower, TIME_SENSITIVE_KEYWORDS)) {
            return Optional.of(query + " " + year);
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
