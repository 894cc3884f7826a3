package com.assistant.relevance.router;

import com.assistant.relevance.similarity.ScoringConfig;

import java.util.List;
import java.util.Objects;

/**
 * The mutable part of a router: its routes and global gating parameters.
 *
 * @param routes      routes in scoring order
 * @param hybridAlpha global hybrid alpha
 * @param minScoreGap default minimum gap between the best and second-best score
 */
public record RouterSettings(List<Route> routes, double hybridAlpha, double minScoreGap) {

    public static final double DEFAULT_MIN_SCORE_GAP = 0.03;
    public static final double MAX_MIN_SCORE_GAP = 0.5;

    public RouterSettings {
        Objects.requireNonNull(routes, "routes is required");
        routes = List.copyOf(routes);
        hybridAlpha = ScoringConfig.clampAlpha(hybridAlpha);
        minScoreGap = clampGap(minScoreGap);
    }

    public static RouterSettings defaults() {
        return new RouterSettings(DefaultRoutes.routes(), ScoringConfig.defaults().hybridAlpha(), DEFAULT_MIN_SCORE_GAP);
    }

    public static double clampGap(double gap) {
        if (Double.isNaN(gap)) {
            return DEFAULT_MIN_SCORE_GAP;
        }
        return Math.max(0.0, Math.min(MAX_MIN_SCORE_GAP, gap));
    }

    public RouterSettings withRoutes(List<Route> newRoutes) {
        return new RouterSettings(newRoutes, hybridAlpha, minScoreGap);
    }
}
