package com.assistant.relevance.router;

import java.util.Objects;

/**
 * Hybrid score of one route for one query.
 */
public record RouteScore(RouteName name, double score) {

    public RouteScore {
        Objects.requireNonNull(name, "name is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }
}
