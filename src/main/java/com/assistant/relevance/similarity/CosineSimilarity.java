package com.assistant.relevance.similarity;

import com.assistant.relevance.vector.SparseVector;

/**
 * Cosine similarity of two sparse vectors. Weights are non-negative, so the result lies
 * in [0, 1]; an empty or zero-norm operand yields 0.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
        // Utility class
    }

    public static double compute(SparseVector a, SparseVector b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.norm() == 0.0 || b.norm() == 0.0) {
            return 0.0;
        }
        SparseVector small = a.size() <= b.size() ? a : b;
        SparseVector large = small == a ? b : a;
        double dot = 0.0;
        for (String term : small.terms()) {
            if (large.contains(term)) {
                dot += small.get(term) * large.get(term);
            }
        }
        double cosine = dot / (a.norm() * b.norm());
        return Math.max(0.0, Math.min(1.0, cosine));
    }
}
