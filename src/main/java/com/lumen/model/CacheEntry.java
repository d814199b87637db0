package com.lumen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached model response.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    /**
     * SHA-256 of the canonical (prompt, model, options) form.
     */
    private String key;

    private String content;

    private String model;

    private String prompt;

    private Instant createdAt;

    private Duration ttl;

    private TokenUsage tokenUsage;

    /**
     * Heuristic confidence (0.0-1.0). Diagnostic ranking only.
     */
    private double confidenceScore;

    private long processingTimeMs;

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    /**
     * An entry is stale from the instant its TTL has fully elapsed.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
