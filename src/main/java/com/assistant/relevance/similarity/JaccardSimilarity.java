package com.assistant.relevance.similarity;

import java.util.Set;

/**
 * Jaccard similarity (token overlap).
 * Computes similarity as |intersection| / |union| of two token sets.
 * Two empty sets are considered identical.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
    }

    /**
     * Jaccard index of two sets; 1.0 when both are empty, 0.0 when only one is.
     */
    public static double of(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = left.size() <= right.size() ? left : right;
        Set<String> larger = smaller == left ? right : left;

        // Count intersection without creating a copy
        int intersectionSize = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = left.size() + right.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }
}
