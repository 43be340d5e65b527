package com.answer.pipeline.model;

import java.time.Instant;

public record CostRecord(String provider, double amount, Instant timestamp, String requestFingerprint) {
}
