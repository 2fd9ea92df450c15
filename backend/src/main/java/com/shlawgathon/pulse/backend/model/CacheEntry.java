package com.shlawgathon.pulse.backend.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A memoized result held by the insight cache.
 */
public record CacheEntry<T>(String key, T payload, Instant createdAt, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public Duration remainingAt(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
