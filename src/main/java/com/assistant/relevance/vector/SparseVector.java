package com.assistant.relevance.vector;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable sparse term-weight vector with a precomputed L2 norm.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(Map.of());

    private final Map<String, Double> weights;
    private final double norm;

    private SparseVector(Map<String, Double> weights) {
        this.weights = weights;
        double sum = 0.0;
        for (double value : weights.values()) {
            sum += value * value;
        }
        this.norm = Math.sqrt(sum);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public static SparseVector of(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            return EMPTY;
        }
        return new SparseVector(Collections.unmodifiableMap(new LinkedHashMap<>(weights)));
    }

    /**
     * Arithmetic mean of the given vectors; empty input gives the empty vector.
     */
    public static SparseVector mean(Collection<SparseVector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            return EMPTY;
        }
        Map<String, Double> merged = new LinkedHashMap<>();
        for (SparseVector vector : vectors) {
            vector.weights.forEach((term, value) -> merged.merge(term, value, Double::sum));
        }
        int count = vectors.size();
        merged.replaceAll((term, value) -> value / count);
        return new SparseVector(Collections.unmodifiableMap(merged));
    }

    public double get(String term) {
        return weights.getOrDefault(term, 0.0);
    }

    public boolean contains(String term) {
        return weights.containsKey(term);
    }

    public Set<String> terms() {
        return weights.keySet();
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public double norm() {
        return norm;
    }

    @Override
    public String toString() {
        return "SparseVector{size=" + weights.size() + ", norm=" + String.format("%.4f", norm) + "}";
    }
}
