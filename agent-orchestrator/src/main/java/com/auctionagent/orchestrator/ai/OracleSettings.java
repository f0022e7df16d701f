package com.auctionagent.orchestrator.ai;

import java.time.Duration;

/**
 * Oracle call budget.
 *
 * @param maxAttempts    total attempts including the first call
 * @param baseDelay      first backoff delay, doubled per retry
 * @param maxDelay       cap on a single backoff delay
 * @param attemptTimeout hard deadline for one HTTP round trip
 */
public record OracleSettings(
    String   apiKey,
    int      maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    Duration attemptTimeout,
    int      maxTokens
) {
    public OracleSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
