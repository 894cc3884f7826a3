package com.assistant.relevance.similarity;

/**
 * Weights of the hybrid route score.
 *
 * @param hybridAlpha        blend of lexical (word) versus character-trigram similarity
 * @param bm25Weight         share of BM25 inside the lexical signal (lambda)
 * @param negativePenalty    weight of the negative-example cosine penalty (beta)
 * @param bm25K1             BM25 term-frequency saturation
 * @param bm25B              BM25 length normalization
 * @param bm25SaturationScale scale of the {@code 1 - e^(-raw/scale)} squashing
 */
public record ScoringConfig(
        double hybridAlpha,
        double bm25Weight,
        double negativePenalty,
        double bm25K1,
        double bm25B,
        double bm25SaturationScale
) {
    public static final double MIN_ALPHA = 0.05;
    public static final double MAX_ALPHA = 0.95;

    public ScoringConfig {
        if (bm25Weight < 0.0 || bm25Weight > 1.0) {
            throw new IllegalArgumentException("bm25Weight must be between 0.0 and 1.0");
        }
        if (negativePenalty < 0.0 || negativePenalty > 1.0) {
            throw new IllegalArgumentException("negativePenalty must be between 0.0 and 1.0");
        }
        if (bm25SaturationScale <= 0.0) {
            throw new IllegalArgumentException("bm25SaturationScale must be > 0");
        }
        hybridAlpha = clampAlpha(hybridAlpha);
    }

    /**
     * alpha 0.72, lambda 0.35, beta 0.18, k1 1.2, b 0.75, saturation scale 6.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(0.72, 0.35, 0.18, 1.2, 0.75, 6.0);
    }

    public ScoringConfig withHybridAlpha(double alpha) {
        return new ScoringConfig(alpha, bm25Weight, negativePenalty, bm25K1, bm25B, bm25SaturationScale);
    }

    public static double clampAlpha(double alpha) {
        if (Double.isNaN(alpha)) {
            return 0.72;
        }
        return Math.max(MIN_ALPHA, Math.min(MAX_ALPHA, alpha));
    }
}
