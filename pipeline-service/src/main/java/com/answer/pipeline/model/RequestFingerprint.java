package com.answer.pipeline.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Digest of the normalized query plus the parameters that change the response. Two
 * requests with equal fingerprints are interchangeable for caching and single-flight.
 */
public record RequestFingerprint(String value) {

    public static RequestFingerprint of(SearchRequest request) {
        String material = normalizeQuery(request.query())
                + "|max_results=" + request.effectiveMaxResults()
                + "|include_sources=" + request.effectiveIncludeSources();
        return new RequestFingerprint(sha256(material));
    }

    public static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String sha256(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public String shortValue() {
        return value.length() <= 12 ? value : value.substring(0, 12);
    }

    @Override
    public String toString() {
        return value;
    }
}
