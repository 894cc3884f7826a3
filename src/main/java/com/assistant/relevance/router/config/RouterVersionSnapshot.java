package com.assistant.relevance.router.config;

import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouterSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A labeled, immutable copy of a router configuration.
 *
 * @param id          snapshot identifier ({@code rv-...})
 * @param createdAt   ISO-8601 creation instant
 * @param label       operator label
 * @param routes      persisted routes
 * @param hybridAlpha global hybrid alpha
 * @param minScoreGap default minimum score gap
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouterVersionSnapshot(
        String id,
        String createdAt,
        String label,
        List<RouteEntry> routes,
        double hybridAlpha,
        double minScoreGap
) {
    public RouterVersionSnapshot {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    /**
     * Converts back to router settings, dropping invalid routes.
     *
     * @throws RouterConfigException when no valid route remains
     */
    public RouterSettings toSettings() {
        List<Route> converted = RouteEntries.toRoutes(routes);
        if (converted.isEmpty()) {
            throw new RouterConfigException("Snapshot " + id + " has no valid routes");
        }
        return new RouterSettings(converted, hybridAlpha, minScoreGap);
    }
}
