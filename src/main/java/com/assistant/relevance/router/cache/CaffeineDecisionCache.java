package com.assistant.relevance.router.cache;

import com.assistant.relevance.router.RouteDecision;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed decision cache. Caffeine handles expiry; an insertion-order index
 * enforces the hard entry cap by evicting the oldest inserted key first.
 */
public class CaffeineDecisionCache implements DecisionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineDecisionCache.class);

    private final Cache<DecisionCacheKey, CachedDecision> cache;
    // Secondary index: keys in insertion order
    private final Deque<DecisionCacheKey> insertionOrder = new ConcurrentLinkedDeque<>();
    private final AtomicLong capacityEvictions = new AtomicLong();
    private final int maxEntries;
    private final Clock clock;

    public CaffeineDecisionCache(DecisionCacheConfig config) {
        this(config, Ticker.systemTicker(), ForkJoinPool.commonPool(), Clock.systemUTC());
    }

    /**
     * Creates a cache with an explicit time source and maintenance executor.
     */
    public CaffeineDecisionCache(DecisionCacheConfig config, Ticker ticker, Executor executor, Clock clock) {
        this.maxEntries = config.maxEntries();
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .executor(executor)
                .recordStats()
                .removalListener((DecisionCacheKey key, CachedDecision value, RemovalCause cause) -> {
                    if (key != null && cause.wasEvicted()) {
                        forgetIfAbsent(key);
                    }
                })
                .build();
        log.info("CaffeineDecisionCache initialized: maxEntries={}, ttl={}", config.maxEntries(), config.ttl());
    }

    @Override
    public Optional<CachedDecision> get(DecisionCacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public synchronized void put(DecisionCacheKey key, RouteDecision decision) {
        insertionOrder.remove(key);
        cache.put(key, new CachedDecision(Instant.now(clock), decision));
        insertionOrder.addLast(key);
        while (insertionOrder.size() > maxEntries) {
            DecisionCacheKey oldest = insertionOrder.pollFirst();
            if (oldest == null) {
                break;
            }
            cache.invalidate(oldest);
            capacityEvictions.incrementAndGet();
            log.debug("decision.cache.evicted key={}", oldest.normalizedText());
        }
    }

    // Notifications arrive late; a key re-put after expiry must stay in the index
    private synchronized void forgetIfAbsent(DecisionCacheKey key) {
        if (!cache.asMap().containsKey(key)) {
            insertionOrder.remove(key);
        }
    }

    @Override
    public synchronized void invalidateAll() {
        cache.invalidateAll();
        insertionOrder.clear();
        log.debug("Invalidated all decision cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount() + capacityEvictions.get(),
                cache.estimatedSize()
        );
    }
}
