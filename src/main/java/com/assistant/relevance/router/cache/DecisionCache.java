package com.assistant.relevance.router.cache;

import com.assistant.relevance.router.RouteDecision;

import java.util.Optional;

/**
 * Memoization layer over route classification. Clearing it never affects correctness.
 */
public interface DecisionCache {

    /**
     * Gets a cached outcome.
     *
     * @param key the decision key
     * @return the cached outcome, or empty if absent or expired
     */
    Optional<CachedDecision> get(DecisionCacheKey key);

    /**
     * Caches an outcome.
     *
     * @param key      the decision key
     * @param decision the accepted decision, or null when no route qualified
     */
    void put(DecisionCacheKey key, RouteDecision decision);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    CacheStats getStats();
}
