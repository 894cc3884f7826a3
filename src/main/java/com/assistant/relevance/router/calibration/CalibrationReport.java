package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.RouteName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a threshold calibration run.
 *
 * @param totalLabeled     number of usable labeled samples
 * @param beforeAccuracy   dataset accuracy with the original thresholds
 * @param afterAccuracy    dataset accuracy with the fitted thresholds
 * @param improved         whether the thresholds changed for the better
 * @param beforeThresholds thresholds before the run
 * @param afterThresholds  thresholds after the run
 */
public record CalibrationReport(
        int totalLabeled,
        double beforeAccuracy,
        double afterAccuracy,
        boolean improved,
        Map<RouteName, Double> beforeThresholds,
        Map<RouteName, Double> afterThresholds
) {
    public CalibrationReport {
        beforeThresholds = Collections.unmodifiableMap(new LinkedHashMap<>(beforeThresholds));
        afterThresholds = Collections.unmodifiableMap(new LinkedHashMap<>(afterThresholds));
    }

    /**
     * A report for a run that did not change anything.
     */
    public static CalibrationReport unchanged(int totalLabeled, double accuracy, Map<RouteName, Double> thresholds) {
        return new CalibrationReport(totalLabeled, accuracy, accuracy, false, thresholds, thresholds);
    }
}
