package com.assistant.relevance.router.cache;

import com.assistant.relevance.router.RouteDecision;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A memoized route outcome. A null decision records that no route qualified.
 */
public record CachedDecision(Instant cachedAt, RouteDecision decision) {

    public CachedDecision {
        Objects.requireNonNull(cachedAt, "cachedAt is required");
    }

    public Optional<RouteDecision> asOptional() {
        return Optional.ofNullable(decision);
    }
}
