package com.assistant.relevance.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Down-weights old memory with a floored exponential half-life.
 *
 * <p>Formula:</p>
 * <pre>
 * factor = floor + (1 - floor) * exp(-ln2 * ageDays / halfLifeDays)
 * </pre>
 *
 * <p>Lines of unknown or non-positive age keep factor 1.</p>
 */
public class TemporalDecay {
    private static final Logger log = LoggerFactory.getLogger(TemporalDecay.class);

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final double halfLifeDays;
    private final double floor;

    /**
     * Half-life of 21 days with a floor of 0.65.
     */
    public TemporalDecay() {
        this(21.0, 0.65);
    }

    /**
     * @param halfLifeDays days until the decaying share halves
     * @param floor        factor approached by very old lines (0.0-1.0)
     */
    public TemporalDecay(double halfLifeDays, double floor) {
        if (halfLifeDays <= 0.0) {
            throw new IllegalArgumentException("halfLifeDays must be > 0");
        }
        if (floor < 0.0 || floor > 1.0) {
            throw new IllegalArgumentException("floor must be between 0.0 and 1.0");
        }
        this.halfLifeDays = halfLifeDays;
        this.floor = floor;
    }

    /**
     * Multiplier for a line of the given age.
     */
    public double factor(double ageDays) {
        if (!Double.isFinite(ageDays) || ageDays <= 0.0) {
            return 1.0;
        }
        double decay = Math.exp(-Math.log(2) * (ageDays / halfLifeDays));
        double factor = floor + (1.0 - floor) * decay;
        log.trace("Temporal decay: age={} factor={}", ageDays, factor);
        return factor;
    }

    /**
     * Age in fractional days between two instants, never negative.
     */
    public static double ageDays(Instant from, Instant now) {
        double days = Duration.between(from, now).toMillis() / 1000.0 / SECONDS_PER_DAY;
        return Math.max(0.0, days);
    }

    public double getHalfLifeDays() {
        return halfLifeDays;
    }

    public double getFloor() {
        return floor;
    }
}
