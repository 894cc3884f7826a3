package com.assistant.relevance.similarity;

/**
 * Weights of the lexical "semantic" overlap: token Jaccard plus character n-gram Jaccard.
 */
public record OverlapWeights(double tokenWeight, double ngramWeight) {

    public OverlapWeights {
        if (tokenWeight < 0 || ngramWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = tokenWeight + ngramWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 0.65 token overlap, 0.35 character n-gram overlap.
     */
    public static OverlapWeights defaultWeights() {
        return new OverlapWeights(0.65, 0.35);
    }
}
