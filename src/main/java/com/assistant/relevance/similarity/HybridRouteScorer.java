package com.assistant.relevance.similarity;

import com.assistant.relevance.vector.RouteCentroid;
import com.assistant.relevance.vector.SparseVector;
import com.assistant.relevance.vector.TermDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fuses word cosine, BM25, character-trigram cosine and the negative-example penalty
 * into one bounded route score.
 * Formula: hybrid = a*((1-l)*wordCos + l*bm25) + (1-a)*charCos + boost - b*(a*negWord + (1-a)*negChar)
 */
public class HybridRouteScorer {
    private static final Logger log = LoggerFactory.getLogger(HybridRouteScorer.class);

    private final ScoringConfig config;
    private final Bm25Scorer bm25;

    public HybridRouteScorer(ScoringConfig config) {
        this.config = config;
        this.bm25 = new Bm25Scorer(config.bm25K1(), config.bm25B());
    }

    public ScoringConfig getConfig() {
        return config;
    }

    /**
     * Scores one query against one trained route.
     *
     * @param query          the query terms
     * @param queryWord      query word-space vector
     * @param queryChars     query character-trigram vector
     * @param centroid       the route centroid
     * @param routeDocuments the route's positive training documents
     * @param corpus         BM25 statistics over all training documents
     * @param alpha          effective hybrid alpha for this query and route
     * @param boost          external additive boost
     */
    public ScoreBreakdown score(TermDocument query, SparseVector queryWord, SparseVector queryChars,
                                RouteCentroid centroid, List<TermDocument> routeDocuments,
                                Bm25Scorer.CorpusStats corpus, double alpha, double boost) {
        double wordCosine = CosineSimilarity.compute(queryWord, centroid.word());
        double charCosine = CosineSimilarity.compute(queryChars, centroid.chars());
        double negativeWord = CosineSimilarity.compute(queryWord, centroid.negativeWord());
        double negativeChars = CosineSimilarity.compute(queryChars, centroid.negativeChars());

        double bestRaw = 0.0;
        for (TermDocument document : routeDocuments) {
            double raw = bm25.score(query.wordTerms(), document.wordFrequencies(), document.length(), corpus);
            bestRaw = Math.max(bestRaw, raw);
        }
        double bm25Score = Bm25Scorer.saturate(bestRaw, config.bm25SaturationScale());

        double a = ScoringConfig.clampAlpha(alpha);
        double lambda = config.bm25Weight();
        double lexical = (1.0 - lambda) * wordCosine + lambda * bm25Score;
        double penalty = config.negativePenalty() * (a * negativeWord + (1.0 - a) * negativeChars);
        double safeBoost = Double.isFinite(boost) ? boost : 0.0;
        double hybrid = clamp01(a * lexical + (1.0 - a) * charCosine + safeBoost - penalty);

        log.trace("route.score word={} bm25={} char={} negWord={} negChar={} alpha={} boost={} hybrid={}",
                wordCosine, bm25Score, charCosine, negativeWord, negativeChars, a, safeBoost, hybrid);
        return new ScoreBreakdown(wordCosine, bm25Score, charCosine, negativeWord, negativeChars, a, safeBoost, hybrid);
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Individual signals behind one hybrid score.
     */
    public record ScoreBreakdown(
            double wordCosine,
            double bm25,
            double charCosine,
            double negativeWord,
            double negativeChars,
            double alpha,
            double boost,
            double hybrid
    ) {
        @Override
        public String toString() {
            return String.format(
                    "ScoreBreakdown{word=%.4f, bm25=%.4f, char=%.4f, neg=(%.4f, %.4f), alpha=%.2f, boost=%.2f, hybrid=%.4f}",
                    wordCosine, bm25, charCosine, negativeWord, negativeChars, alpha, boost, hybrid);
        }
    }
}
