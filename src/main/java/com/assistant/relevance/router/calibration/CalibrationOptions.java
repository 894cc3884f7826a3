package com.assistant.relevance.router.calibration;

import java.util.List;
import java.util.Objects;

/**
 * Options for offline threshold calibration.
 */
public class CalibrationOptions {

    private static final int DEFAULT_MIN_SAMPLES = 25;
    private static final int DEFAULT_ROUNDS = 4;
    private static final double DEFAULT_SEARCH_RANGE = 0.12;
    private static final double DEFAULT_SEARCH_STEP = 0.02;
    private static final int DEFAULT_JITTER_TRIALS = 300;
    private static final double DEFAULT_JITTER_MAGNITUDE = 0.04;
    private static final long DEFAULT_SEED = 42L;
    private static final List<Double> DEFAULT_QUANTILES = List.of(0.1, 0.2, 0.3, 0.4, 0.5);

    private final int minSamples;
    private final int rounds;
    private final double searchRange;
    private final double searchStep;
    private final List<Double> quantiles;
    private final int jitterTrials;
    private final double jitterMagnitude;
    private final long seed;

    private CalibrationOptions(Builder builder) {
        this.minSamples = builder.minSamples;
        this.rounds = builder.rounds;
        this.searchRange = builder.searchRange;
        this.searchStep = builder.searchStep;
        this.quantiles = List.copyOf(builder.quantiles);
        this.jitterTrials = builder.jitterTrials;
        this.jitterMagnitude = builder.jitterMagnitude;
        this.seed = builder.seed;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getRounds() {
        return rounds;
    }

    public double getSearchRange() {
        return searchRange;
    }

    public double getSearchStep() {
        return searchStep;
    }

    public List<Double> getQuantiles() {
        return quantiles;
    }

    public int getJitterTrials() {
        return jitterTrials;
    }

    public double getJitterMagnitude() {
        return jitterMagnitude;
    }

    public long getSeed() {
        return seed;
    }

    public static CalibrationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int minSamples = DEFAULT_MIN_SAMPLES;
        private int rounds = DEFAULT_ROUNDS;
        private double searchRange = DEFAULT_SEARCH_RANGE;
        private double searchStep = DEFAULT_SEARCH_STEP;
        private List<Double> quantiles = DEFAULT_QUANTILES;
        private int jitterTrials = DEFAULT_JITTER_TRIALS;
        private double jitterMagnitude = DEFAULT_JITTER_MAGNITUDE;
        private long seed = DEFAULT_SEED;

        public Builder minSamples(int minSamples) {
            if (minSamples <= 0) {
                throw new IllegalArgumentException("minSamples must be positive");
            }
            this.minSamples = minSamples;
            return this;
        }

        public Builder rounds(int rounds) {
            if (rounds <= 0) {
                throw new IllegalArgumentException("rounds must be positive");
            }
            this.rounds = rounds;
            return this;
        }

        public Builder searchRange(double searchRange) {
            if (searchRange < 0.0 || searchRange > 1.0) {
                throw new IllegalArgumentException("searchRange must be between 0.0 and 1.0");
            }
            this.searchRange = searchRange;
            return this;
        }

        public Builder searchStep(double searchStep) {
            if (searchStep <= 0.0 || searchStep > 1.0) {
                throw new IllegalArgumentException("searchStep must be in (0.0, 1.0]");
            }
            this.searchStep = searchStep;
            return this;
        }

        public Builder quantiles(List<Double> quantiles) {
            Objects.requireNonNull(quantiles, "quantiles is required");
            for (double q : quantiles) {
                if (q < 0.0 || q > 1.0) {
                    throw new IllegalArgumentException("quantiles must be between 0.0 and 1.0");
                }
            }
            this.quantiles = quantiles;
            return this;
        }

        public Builder jitterTrials(int jitterTrials) {
            if (jitterTrials < 0) {
                throw new IllegalArgumentException("jitterTrials must be non-negative");
            }
            this.jitterTrials = jitterTrials;
            return this;
        }

        public Builder jitterMagnitude(double jitterMagnitude) {
            if (jitterMagnitude < 0.0 || jitterMagnitude > 1.0) {
                throw new IllegalArgumentException("jitterMagnitude must be between 0.0 and 1.0");
            }
            this.jitterMagnitude = jitterMagnitude;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public CalibrationOptions build() {
            return new CalibrationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CalibrationOptions{" +
                "minSamples=" + minSamples +
                ", rounds=" + rounds +
                ", searchRange=" + searchRange +
                ", searchStep=" + searchStep +
                ", quantiles=" + quantiles +
                ", jitterTrials=" + jitterTrials +
                ", jitterMagnitude=" + jitterMagnitude +
                ", seed=" + seed +
                '}';
    }
}
