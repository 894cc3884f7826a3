package com.assistant.relevance.router.cache;

import com.assistant.relevance.router.RouteName;
import com.assistant.relevance.router.RouteOptions;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cache key combining the normalized text with every option that influences the outcome.
 * Collections are stored sorted so that equivalent options produce equal keys.
 *
 * @param normalizedText canonical query text
 * @param allowed        sorted allowed route ids, or null when all routes are allowed
 * @param boosts         boosts by route id
 * @param alphaOverrides alpha overrides by route id
 * @param topK           number of alternatives
 * @param minGap         effective minimum score gap
 */
public record DecisionCacheKey(
        String normalizedText,
        List<String> allowed,
        Map<String, Double> boosts,
        Map<String, Double> alphaOverrides,
        int topK,
        double minGap
) {
    public DecisionCacheKey {
        Objects.requireNonNull(normalizedText, "normalizedText is required");
        allowed = allowed == null ? null : List.copyOf(allowed);
        boosts = Map.copyOf(boosts);
        alphaOverrides = Map.copyOf(alphaOverrides);
    }

    public static DecisionCacheKey of(String normalizedText, RouteOptions options, double effectiveMinGap) {
        List<String> allowed = options.getAllowed() == null ? null
                : options.getAllowed().stream().map(RouteName::getId).sorted().toList();
        return new DecisionCacheKey(
                normalizedText,
                allowed,
                byId(options.getBoosts()),
                byId(options.getAlphaOverrides()),
                options.getTopK(),
                effectiveMinGap);
    }

    private static Map<String, Double> byId(Map<RouteName, Double> values) {
        Map<String, Double> sorted = new TreeMap<>();
        values.forEach((name, value) -> sorted.put(name.getId(), value));
        return sorted;
    }
}
