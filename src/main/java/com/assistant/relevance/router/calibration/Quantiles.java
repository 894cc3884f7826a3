package com.assistant.relevance.router.calibration;

import java.util.Collection;

/**
 * Linear-interpolated quantiles.
 */
public final class Quantiles {

    private Quantiles() {
        // Utility class
    }

    /**
     * Returns the {@code q} quantile of the values, or 0 for an empty collection.
     */
    public static double quantile(Collection<Double> values, double q) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        double position = Math.max(0.0, Math.min(sorted.length - 1, (sorted.length - 1) * q));
        int base = (int) Math.floor(position);
        double rest = position - base;
        double left = sorted[base];
        double right = sorted[Math.min(sorted.length - 1, base + 1)];
        return left + (right - left) * rest;
    }
}
