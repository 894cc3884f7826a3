package com.assistant.relevance.router.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the decision cache.
 *
 * @param maxEntries hard cap on entries; the oldest inserted entry is evicted first
 * @param ttl        time-to-live of each entry
 * @param enabled    whether caching is enabled
 */
public record DecisionCacheConfig(int maxEntries, Duration ttl, boolean enabled) {

    public DecisionCacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default configuration: 500 entries, 5 minute TTL, enabled.
     */
    public static DecisionCacheConfig defaults() {
        return new DecisionCacheConfig(500, Duration.ofMinutes(5), true);
    }

    public static DecisionCacheConfig disabled() {
        return new DecisionCacheConfig(1, Duration.ofSeconds(1), false);
    }
}
