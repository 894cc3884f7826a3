package com.assistant.relevance.similarity;

import com.assistant.relevance.text.Tokenizer;

import java.util.Set;

/**
 * Composite lexical-overlap scorer standing in for semantic similarity.
 * Formula: score = wToken*tokenJaccard + wNgram*charNgramJaccard
 *
 * <p>Callers pass precomputed sets so a query's sets are built once per search.</p>
 */
public class SemanticOverlapScorer {

    private static final int NGRAM_SIZE = 3;

    private final Tokenizer tokenizer;
    private final OverlapWeights weights;

    public SemanticOverlapScorer(Tokenizer tokenizer) {
        this(tokenizer, OverlapWeights.defaultWeights());
    }

    public SemanticOverlapScorer(Tokenizer tokenizer, OverlapWeights weights) {
        this.tokenizer = tokenizer;
        this.weights = weights;
    }

    /**
     * Scores precomputed token and n-gram sets. Stays within [0, 1].
     */
    public double compute(Set<String> queryTokens, Set<String> queryNgrams,
                          Set<String> docTokens, Set<String> docNgrams) {
        double tokenScore = JaccardSimilarity.of(queryTokens, docTokens);
        double ngramScore = JaccardSimilarity.of(queryNgrams, docNgrams);
        return weights.tokenWeight() * tokenScore + weights.ngramWeight() * ngramScore;
    }

    /**
     * Character trigrams of the folded text.
     */
    public Set<String> ngrams(String text) {
        return tokenizer.charNgramSet(text, NGRAM_SIZE);
    }
}
