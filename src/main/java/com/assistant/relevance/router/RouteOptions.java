package com.assistant.relevance.router;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-call options for route classification.
 * Restricts candidate routes, adds contextual boosts, overrides alpha per route
 * and tunes the acceptance gap.
 */
public class RouteOptions {

    public static final int DEFAULT_TOP_K = 3;
    public static final int MAX_TOP_K = 10;

    private final Set<RouteName> allowed;
    private final Map<RouteName, Double> boosts;
    private final Map<RouteName, Double> alphaOverrides;
    private final int topK;
    private final Double minGap;

    private RouteOptions(Builder builder) {
        this.allowed = builder.allowed == null ? null : Collections.unmodifiableSet(EnumSet.copyOf(builder.allowed));
        this.boosts = Collections.unmodifiableMap(new EnumMap<>(builder.boosts));
        this.alphaOverrides = Collections.unmodifiableMap(new EnumMap<>(builder.alphaOverrides));
        this.topK = builder.topK;
        this.minGap = builder.minGap;
    }

    /**
     * Allowed routes, or null when every route is a candidate.
     */
    public Set<RouteName> getAllowed() {
        return allowed;
    }

    public boolean isAllowed(RouteName name) {
        return allowed == null || allowed.contains(name);
    }

    public Map<RouteName, Double> getBoosts() {
        return boosts;
    }

    public Map<RouteName, Double> getAlphaOverrides() {
        return alphaOverrides;
    }

    public int getTopK() {
        return topK;
    }

    /**
     * Per-call minimum gap, or null to use the router's configured gap.
     */
    public Double getMinGap() {
        return minGap;
    }

    public static RouteOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<RouteName> allowed;
        private final Map<RouteName, Double> boosts = new EnumMap<>(RouteName.class);
        private final Map<RouteName, Double> alphaOverrides = new EnumMap<>(RouteName.class);
        private int topK = DEFAULT_TOP_K;
        private Double minGap;

        public Builder allowed(Collection<RouteName> allowed) {
            Objects.requireNonNull(allowed, "allowed is required");
            this.allowed = allowed.isEmpty() ? EnumSet.noneOf(RouteName.class) : EnumSet.copyOf(allowed);
            return this;
        }

        public Builder allowed(RouteName first, RouteName... rest) {
            this.allowed = EnumSet.of(first, rest);
            return this;
        }

        public Builder boost(RouteName name, double boost) {
            Objects.requireNonNull(name, "name is required");
            if (!Double.isFinite(boost)) {
                throw new IllegalArgumentException("boost must be finite");
            }
            this.boosts.put(name, boost);
            return this;
        }

        public Builder boosts(Map<RouteName, Double> boosts) {
            boosts.forEach(this::boost);
            return this;
        }

        public Builder alphaOverride(RouteName name, double alpha) {
            Objects.requireNonNull(name, "name is required");
            if (Double.isNaN(alpha)) {
                throw new IllegalArgumentException("alpha must be a number");
            }
            this.alphaOverrides.put(name, alpha);
            return this;
        }

        public Builder alphaOverrides(Map<RouteName, Double> overrides) {
            overrides.forEach(this::alphaOverride);
            return this;
        }

        /**
         * Number of alternatives to report; clamped to 1..10.
         */
        public Builder topK(int topK) {
            this.topK = Math.max(1, Math.min(MAX_TOP_K, topK));
            return this;
        }

        public Builder minGap(double minGap) {
            if (minGap < 0.0 || minGap > 1.0) {
                throw new IllegalArgumentException("minGap must be between 0.0 and 1.0");
            }
            this.minGap = minGap;
            return this;
        }

        public RouteOptions build() {
            return new RouteOptions(this);
        }
    }

    @Override
    public String toString() {
        return "RouteOptions{" +
                "allowed=" + allowed +
                ", boosts=" + boosts +
                ", alphaOverrides=" + alphaOverrides +
                ", topK=" + topK +
                ", minGap=" + minGap +
                '}';
    }
}
