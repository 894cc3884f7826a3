package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouteName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Searches per-route thresholds that maximize an accuracy objective.
 * Coordinate descent over candidate thresholds, then seeded random jitter of all
 * thresholds at once. Only strict improvements are kept, so the returned accuracy is
 * never below the initial one.
 */
public class ThresholdOptimizer {
    private static final Logger log = LoggerFactory.getLogger(ThresholdOptimizer.class);

    private static final double IMPROVEMENT_EPSILON = 1e-9;

    private final CalibrationOptions options;

    public ThresholdOptimizer(CalibrationOptions options) {
        this.options = options;
    }

    /**
     * Builds the candidate list for one route: the configured quantiles of its
     * true-positive scores plus the current threshold moved by multiples of the
     * search step within the search range.
     */
    public List<Double> candidates(double current, Collection<Double> truePositiveScores) {
        List<Double> candidates = new ArrayList<>();
        if (!truePositiveScores.isEmpty()) {
            for (double q : options.getQuantiles()) {
                candidates.add(round(Quantiles.quantile(truePositiveScores, q)));
            }
        }
        int steps = (int) Math.floor(options.getSearchRange() / options.getSearchStep() + IMPROVEMENT_EPSILON);
        for (int k = 1; k <= steps; k++) {
            candidates.add(round(current - k * options.getSearchStep()));
            candidates.add(round(current + k * options.getSearchStep()));
        }
        return candidates.stream().map(Route::clampThreshold).distinct().toList();
    }

    /**
     * Optimizes the thresholds.
     *
     * @param initial    starting thresholds, iterated in map order
     * @param candidates candidate thresholds per route
     * @param objective  accuracy of a full threshold assignment
     */
    public Result optimize(Map<RouteName, Double> initial, Map<RouteName, List<Double>> candidates,
                           ToDoubleFunction<Map<RouteName, Double>> objective) {
        Map<RouteName, Double> best = new LinkedHashMap<>(initial);
        double initialAccuracy = objective.applyAsDouble(Collections.unmodifiableMap(best));
        double bestAccuracy = initialAccuracy;
        int evaluations = 1;

        for (int round = 0; round < options.getRounds(); round++) {
            boolean improved = false;
            for (RouteName route : initial.keySet()) {
                for (double candidate : candidates.getOrDefault(route, List.of())) {
                    double threshold = Route.clampThreshold(candidate);
                    if (threshold == best.get(route)) {
                        continue;
                    }
                    Map<RouteName, Double> trial = new LinkedHashMap<>(best);
                    trial.put(route, threshold);
                    double accuracy = objective.applyAsDouble(Collections.unmodifiableMap(trial));
                    evaluations++;
                    if (accuracy > bestAccuracy + IMPROVEMENT_EPSILON) {
                        best = trial;
                        bestAccuracy = accuracy;
                        improved = true;
                    }
                }
            }
            log.debug("calibration.round round={} accuracy={} improved={}", round, bestAccuracy, improved);
            if (!improved) {
                break;
            }
        }

        Random random = new Random(options.getSeed());
        double magnitude = options.getJitterMagnitude();
        for (int trialIndex = 0; trialIndex < options.getJitterTrials() && magnitude > 0.0; trialIndex++) {
            Map<RouteName, Double> trial = new LinkedHashMap<>(best);
            for (Map.Entry<RouteName, Double> entry : trial.entrySet()) {
                double delta = (random.nextDouble() * 2.0 - 1.0) * magnitude;
                entry.setValue(Route.clampThreshold(round(entry.getValue() + delta)));
            }
            double accuracy = objective.applyAsDouble(Collections.unmodifiableMap(trial));
            evaluations++;
            if (accuracy > bestAccuracy + IMPROVEMENT_EPSILON) {
                best = trial;
                bestAccuracy = accuracy;
            }
        }

        log.debug("calibration.optimized initialAccuracy={} accuracy={} evaluations={}",
                initialAccuracy, bestAccuracy, evaluations);
        return new Result(best, initialAccuracy, bestAccuracy, evaluations);
    }

    static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    /**
     * Optimization outcome.
     *
     * @param thresholds      best thresholds found
     * @param initialAccuracy accuracy of the initial thresholds
     * @param accuracy        accuracy of the best thresholds
     * @param evaluations     number of objective evaluations
     */
    public record Result(Map<RouteName, Double> thresholds, double initialAccuracy, double accuracy, int evaluations) {

        public Result {
            thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
        }

        public boolean improved() {
            return accuracy > initialAccuracy;
        }
    }
}
