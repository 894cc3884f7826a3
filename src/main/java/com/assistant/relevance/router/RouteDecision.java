package com.assistant.relevance.router;

import java.util.List;
import java.util.Objects;

/**
 * Accepted classification of one input.
 *
 * @param handler      the winning route
 * @param score        its hybrid score
 * @param reason       human-readable acceptance reason
 * @param alternatives the top scored routes, winner first
 */
public record RouteDecision(
        RouteName handler,
        double score,
        String reason,
        List<RouteScore> alternatives
) {
    public RouteDecision {
        Objects.requireNonNull(handler, "handler is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        alternatives = List.copyOf(alternatives);
    }
}
