package com.assistant.relevance.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fuses the semantic router's alternatives with external routing signals into one ranking.
 * Formula per route: 0.65*semantic + 0.35*[judge pick] + 0.08*[layer allowed]
 * + 0.9*boost + 0.25*calibratedConfidence (top semantic route only)
 */
public class EnsembleRanker {

    static final double SEMANTIC_WEIGHT = 0.65;
    static final double JUDGE_WEIGHT = 0.35;
    static final double LAYER_WEIGHT = 0.08;
    static final double BOOST_WEIGHT = 0.9;
    static final double CALIBRATED_WEIGHT = 0.25;

    /**
     * Ranks candidates, best first. Routes only mentioned by a signal are ranked too.
     */
    public List<RankedRoute> rank(EnsembleInput input) {
        Map<RouteName, Double> scores = new LinkedHashMap<>();
        for (RouteName candidate : input.candidates()) {
            scores.merge(candidate, 0.0, Double::sum);
        }
        for (RouteScore alternative : input.semanticAlternatives()) {
            scores.merge(alternative.name(), clamp01(alternative.score()) * SEMANTIC_WEIGHT, Double::sum);
        }
        if (input.judgeSelected() != null) {
            scores.merge(input.judgeSelected(), JUDGE_WEIGHT, Double::sum);
        }
        for (RouteName candidate : input.candidates()) {
            if (input.layerAllowed().contains(candidate)) {
                scores.merge(candidate, LAYER_WEIGHT, Double::sum);
            }
        }
        input.boosts().forEach((name, boost) -> scores.merge(name, boost * BOOST_WEIGHT, Double::sum));
        if (input.calibratedConfidence() != null && !input.semanticAlternatives().isEmpty()) {
            scores.merge(input.semanticAlternatives().get(0).name(),
                    input.calibratedConfidence() * CALIBRATED_WEIGHT, Double::sum);
        }

        List<RankedRoute> ranked = new ArrayList<>(scores.size());
        scores.forEach((name, score) -> ranked.add(new RankedRoute(name, Math.round(score * 1e6) / 1e6)));
        ranked.sort(Comparator.comparingDouble(RankedRoute::score).reversed());
        return ranked;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Signals fed into the ensemble.
     *
     * @param candidates           routes under consideration
     * @param semanticAlternatives semantic router alternatives, best first
     * @param judgeSelected        route picked by an external judge, or null
     * @param layerAllowed         routes allowed by upstream routing layers
     * @param boosts               contextual boosts
     * @param calibratedConfidence calibrated confidence of the top semantic route, or null
     */
    public record EnsembleInput(
            List<RouteName> candidates,
            List<RouteScore> semanticAlternatives,
            RouteName judgeSelected,
            Set<RouteName> layerAllowed,
            Map<RouteName, Double> boosts,
            Double calibratedConfidence
    ) {
        public EnsembleInput {
            candidates = List.copyOf(Objects.requireNonNullElse(candidates, List.of()));
            semanticAlternatives = List.copyOf(Objects.requireNonNullElse(semanticAlternatives, List.of()));
            layerAllowed = Set.copyOf(Objects.requireNonNullElse(layerAllowed, Set.of()));
            Map<RouteName, Double> ordered = new EnumMap<>(RouteName.class);
            if (boosts != null) {
                ordered.putAll(boosts);
            }
            boosts = Collections.unmodifiableMap(ordered);
        }
    }

    /**
     * One ranked route. Scores are unbounded sums of the weighted signals.
     */
    public record RankedRoute(RouteName name, double score) {}
}
