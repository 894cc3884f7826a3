package com.assistant.relevance.similarity;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 with {@code idf = ln(1 + (N - df + 0.5) / (df + 0.5))}.
 */
public class Bm25Scorer {

    private final double k1;
    private final double b;

    public Bm25Scorer() {
        this(1.2, 0.75);
    }

    public Bm25Scorer(double k1, double b) {
        if (k1 < 0.0) {
            throw new IllegalArgumentException("k1 must be non-negative");
        }
        if (b < 0.0 || b > 1.0) {
            throw new IllegalArgumentException("b must be between 0.0 and 1.0");
        }
        this.k1 = k1;
        this.b = b;
    }

    /**
     * Raw BM25 score of one document.
     *
     * @param queryTerms  query terms, each counted once per occurrence
     * @param docTermFreq term counts of the document
     * @param docLength   document length in terms
     * @param corpus      corpus statistics
     */
    public double score(Collection<String> queryTerms, Map<String, Integer> docTermFreq,
                        int docLength, CorpusStats corpus) {
        if (queryTerms.isEmpty() || corpus.totalDocs() <= 0) {
            return 0.0;
        }
        double avgLength = corpus.avgDocLength() > 0 ? corpus.avgDocLength() : 1.0;
        int length = Math.max(1, docLength);
        double score = 0.0;
        for (String term : queryTerms) {
            int tf = docTermFreq.getOrDefault(term, 0);
            if (tf <= 0) {
                continue;
            }
            int df = corpus.documentFrequency().getOrDefault(term, 0);
            double idf = Math.log(1.0 + (corpus.totalDocs() - df + 0.5) / (df + 0.5));
            double numerator = tf * (k1 + 1.0);
            double denominator = tf + k1 * (1.0 - b + b * (length / avgLength));
            score += idf * (denominator > 0 ? numerator / denominator : 0.0);
        }
        return score;
    }

    /**
     * Maps a raw score into [0, 1) with {@code 1 - e^(-raw / scale)}.
     */
    public static double saturate(double raw, double scale) {
        if (raw <= 0.0 || scale <= 0.0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-raw / scale);
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    /**
     * Corpus-level statistics BM25 needs.
     *
     * @param totalDocs         number of documents
     * @param avgDocLength      mean document length in terms
     * @param documentFrequency number of documents containing each term
     */
    public record CorpusStats(int totalDocs, double avgDocLength, Map<String, Integer> documentFrequency) {

        public CorpusStats {
            documentFrequency = Map.copyOf(documentFrequency);
        }

        /**
         * Builds statistics from per-document term sets and lengths, restricted to the
         * given terms when {@code onlyTerms} is non-null.
         */
        public static CorpusStats of(Collection<Set<String>> docTermSets, Collection<Integer> docLengths,
                                     Collection<String> onlyTerms) {
            Map<String, Integer> df = new HashMap<>();
            if (onlyTerms != null) {
                for (String term : onlyTerms) {
                    int count = 0;
                    for (Set<String> terms : docTermSets) {
                        if (terms.contains(term)) {
                            count++;
                        }
                    }
                    df.put(term, count);
                }
            } else {
                for (Set<String> terms : docTermSets) {
                    for (String term : terms) {
                        df.merge(term, 1, Integer::sum);
                    }
                }
            }
            double totalLength = 0.0;
            for (int length : docLengths) {
                totalLength += Math.max(1, length);
            }
            int totalDocs = docTermSets.size();
            double avg = totalDocs > 0 ? totalLength / totalDocs : 0.0;
            return new CorpusStats(totalDocs, avg, df);
        }
    }
}
