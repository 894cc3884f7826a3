package com.assistant.relevance.router;

import com.assistant.relevance.similarity.ScoringConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named intent backed by example utterances and optional negative examples.
 * Threshold and alpha override are clamped to their domains on construction.
 *
 * @param name               the route name
 * @param utterances         positive example utterances
 * @param negativeUtterances texts that must not pull toward this route
 * @param threshold          minimum hybrid score for acceptance
 * @param alphaOverride      route-specific hybrid alpha, or null for the global one
 */
public record Route(
        RouteName name,
        List<String> utterances,
        List<String> negativeUtterances,
        double threshold,
        Double alphaOverride
) {
    public static final double MIN_THRESHOLD = 0.01;
    public static final double MAX_THRESHOLD = 0.99;

    public Route {
        Objects.requireNonNull(name, "name is required");
        utterances = cleanCopy(utterances);
        negativeUtterances = cleanCopy(negativeUtterances);
        threshold = clampThreshold(threshold);
        if (alphaOverride != null) {
            alphaOverride = ScoringConfig.clampAlpha(alphaOverride);
        }
    }

    public static Route of(RouteName name, double threshold, List<String> utterances) {
        return new Route(name, utterances, List.of(), threshold, null);
    }

    public static double clampThreshold(double threshold) {
        if (Double.isNaN(threshold)) {
            return MIN_THRESHOLD;
        }
        return Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, threshold));
    }

    public Route withThreshold(double newThreshold) {
        return new Route(name, utterances, negativeUtterances, newThreshold, alphaOverride);
    }

    public Route withNegativeUtterances(List<String> negatives) {
        return new Route(name, utterances, negatives, threshold, alphaOverride);
    }

    public Route withAlphaOverride(Double alpha) {
        return new Route(name, utterances, negativeUtterances, threshold, alpha);
    }

    public boolean hasUtterances() {
        return !utterances.isEmpty();
    }

    private static List<String> cleanCopy(List<String> texts) {
        if (texts == null) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(texts.size());
        for (String text : texts) {
            if (text != null && !text.isBlank()) {
                cleaned.add(text.trim());
            }
        }
        return List.copyOf(cleaned);
    }
}
