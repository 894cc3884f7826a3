package com.assistant.relevance.router.cache;

import com.assistant.relevance.router.RouteDecision;

import java.util.Optional;

/**
 * No-op cache used when caching is disabled.
 */
public class NoOpDecisionCache implements DecisionCache {

    @Override
    public Optional<CachedDecision> get(DecisionCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(DecisionCacheKey key, RouteDecision decision) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
