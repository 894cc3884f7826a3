package com.assistant.relevance.memory;

import com.assistant.relevance.similarity.JaccardSimilarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maximal-marginal-relevance reordering of a score-sorted candidate list.
 *
 * <p>The top {@code poolMultiplier * limit} candidates form the pool. Up to
 * {@code resultMultiplier * limit} of them are picked greedily by
 * {@code lambda * relevance - (1 - lambda) * maxJaccard(selected)}, where relevance is the
 * min-max normalized score within the pool. Unpicked pool members follow in score order,
 * then everything outside the pool unchanged.</p>
 */
public class MmrReranker {

    static final Comparator<MemoryCandidate> SCORE_ORDER = Comparator
            .comparingDouble(MemoryCandidate::score).reversed()
            .thenComparing(MemoryCandidate::path)
            .thenComparingInt(MemoryCandidate::line);

    private final double lambda;
    private final int poolMultiplier;
    private final int resultMultiplier;

    public MmrReranker() {
        this(0.72, 4, 2);
    }

    public MmrReranker(double lambda, int poolMultiplier, int resultMultiplier) {
        if (lambda < 0.0 || lambda > 1.0) {
            throw new IllegalArgumentException("lambda must be between 0.0 and 1.0");
        }
        if (poolMultiplier < 1 || resultMultiplier < 1) {
            throw new IllegalArgumentException("multipliers must be >= 1");
        }
        this.lambda = lambda;
        this.poolMultiplier = poolMultiplier;
        this.resultMultiplier = resultMultiplier;
    }

    public List<MemoryCandidate> rerank(List<MemoryCandidate> sorted, int limit) {
        if (sorted.size() <= 1 || limit <= 1) {
            return sorted;
        }
        int poolLimit = Math.min(sorted.size(), Math.max(limit, limit * poolMultiplier));
        int selectionTarget = Math.min(poolLimit, Math.max(limit, limit * resultMultiplier));
        List<MemoryCandidate> pool = sorted.subList(0, poolLimit);

        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (MemoryCandidate candidate : pool) {
            max = Math.max(max, candidate.score());
            min = Math.min(min, candidate.score());
        }
        double range = max - min;

        List<MemoryCandidate> remaining = new ArrayList<>(pool);
        List<MemoryCandidate> selected = new ArrayList<>(selectionTarget);
        while (selected.size() < selectionTarget && !remaining.isEmpty()) {
            int bestIndex = -1;
            double bestMmr = Double.NEGATIVE_INFINITY;
            double bestRaw = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                MemoryCandidate candidate = remaining.get(i);
                double relevance = relevance(candidate.score(), min, range);
                double maxSimilarity = 0.0;
                for (MemoryCandidate chosen : selected) {
                    maxSimilarity = Math.max(maxSimilarity,
                            JaccardSimilarity.of(candidate.similarityTokens(), chosen.similarityTokens()));
                }
                double mmr = lambda * relevance - (1.0 - lambda) * maxSimilarity;
                if (mmr > bestMmr || (mmr == bestMmr && candidate.score() > bestRaw)) {
                    bestIndex = i;
                    bestMmr = mmr;
                    bestRaw = candidate.score();
                }
            }
            if (bestIndex < 0) {
                break;
            }
            selected.add(remaining.remove(bestIndex));
        }

        remaining.sort(SCORE_ORDER);
        List<MemoryCandidate> result = new ArrayList<>(sorted.size());
        result.addAll(selected);
        result.addAll(remaining);
        result.addAll(sorted.subList(poolLimit, sorted.size()));
        return result;
    }

    private static double relevance(double score, double min, double range) {
        if (!Double.isFinite(score)) {
            return 0.0;
        }
        if (range <= 0.0) {
            return 1.0;
        }
        return (score - min) / range;
    }
}
