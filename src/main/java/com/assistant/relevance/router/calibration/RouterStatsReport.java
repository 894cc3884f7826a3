package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.RouteName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-route precision of the semantic router over a logged dataset, with a suggested
 * threshold for each route.
 *
 * @param samples total entries
 * @param routes  statistics per route, in route order
 */
public record RouterStatsReport(int samples, List<RouteStats> routes) {

    static final int MIN_TRUE_POSITIVES = 8;
    static final int MIN_FALSE_POSITIVES = 5;

    public RouterStatsReport {
        routes = List.copyOf(routes);
    }

    /**
     * Builds the report.
     *
     * @param entries    logged interactions
     * @param thresholds current thresholds in route order
     */
    public static RouterStatsReport build(List<DatasetEntry> entries, Map<RouteName, Double> thresholds) {
        List<RouteStats> stats = new ArrayList<>();
        for (Map.Entry<RouteName, Double> route : thresholds.entrySet()) {
            int selected = 0;
            double scoreSum = 0.0;
            List<Double> truePositives = new ArrayList<>();
            List<Double> falsePositives = new ArrayList<>();
            for (DatasetEntry entry : entries) {
                if (entry.semanticScore() == null || !route.getKey().getId().equals(entry.semanticHandler())) {
                    continue;
                }
                selected++;
                scoreSum += entry.semanticScore();
                if (route.getKey().getId().equals(entry.finalHandler())) {
                    truePositives.add(entry.semanticScore());
                } else {
                    falsePositives.add(entry.semanticScore());
                }
            }
            double average = selected > 0 ? scoreSum / selected : 0.0;
            stats.add(new RouteStats(route.getKey(), selected, truePositives.size(), falsePositives.size(),
                    average, route.getValue(),
                    suggestThreshold(route.getValue(), truePositives, falsePositives).orElse(null)));
        }
        return new RouterStatsReport(entries.size(), stats);
    }

    /**
     * Suggests a threshold from true- and false-positive score distributions. Needs
     * {@value #MIN_TRUE_POSITIVES} true positives; suggestions within 0.01 of the current
     * threshold are dropped.
     */
    static Optional<Double> suggestThreshold(double current, List<Double> truePositives, List<Double> falsePositives) {
        if (truePositives.size() < MIN_TRUE_POSITIVES) {
            return Optional.empty();
        }
        double lowTruePositive = Quantiles.quantile(truePositives, 0.2);
        double candidate;
        if (falsePositives.size() < MIN_FALSE_POSITIVES) {
            candidate = Math.max(current, lowTruePositive - 0.01);
        } else {
            double highFalsePositive = Quantiles.quantile(falsePositives, 0.8);
            candidate = highFalsePositive < lowTruePositive
                    ? (highFalsePositive + lowTruePositive) / 2.0
                    : lowTruePositive - 0.01;
        }
        double rounded = Math.round(Math.max(0.05, Math.min(0.95, candidate)) * 1000.0) / 1000.0;
        return Math.abs(rounded - current) >= 0.01 ? Optional.of(rounded) : Optional.empty();
    }

    /**
     * Plain-text rendering, one line per route.
     */
    public String render() {
        StringBuilder sb = new StringBuilder("Intent router stats\n");
        sb.append("samples: ").append(samples).append('\n');
        for (RouteStats route : routes) {
            sb.append(String.format(Locale.ROOT,
                    "- %s | selected=%d | hit=%d | fp=%d | precision=%.1f%% | avg_score=%.3f | threshold=%.3f | suggested=%s%n",
                    route.route().getId(), route.selected(), route.hits(), route.falsePositives(),
                    route.precision() * 100.0, route.averageScore(), route.threshold(),
                    route.suggestedThreshold() == null ? "unchanged"
                            : String.format(Locale.ROOT, "%.3f", route.suggestedThreshold())));
        }
        return sb.toString();
    }

    /**
     * Statistics of one route.
     *
     * @param suggestedThreshold suggested threshold, or null when no change is suggested
     */
    public record RouteStats(
            RouteName route,
            int selected,
            int hits,
            int falsePositives,
            double averageScore,
            double threshold,
            Double suggestedThreshold
    ) {
        public double precision() {
            return selected > 0 ? (double) hits / selected : 0.0;
        }
    }
}
