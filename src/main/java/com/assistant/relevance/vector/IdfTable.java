package com.assistant.relevance.vector;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Smoothed inverse document frequencies: {@code ln((1 + N) / (1 + df)) + 1}.
 * Terms never seen during fitting weigh 1.0.
 */
public final class IdfTable {

    private static final double UNKNOWN_TERM_IDF = 1.0;

    private final int documentCount;
    private final Map<String, Integer> documentFrequency;
    private final Map<String, Double> idfByTerm;

    private IdfTable(int documentCount, Map<String, Integer> documentFrequency) {
        this.documentCount = documentCount;
        this.documentFrequency = Map.copyOf(documentFrequency);
        Map<String, Double> idf = new HashMap<>();
        int total = Math.max(1, documentCount);
        documentFrequency.forEach((term, df) ->
                idf.put(term, Math.log((1.0 + total) / (1.0 + df)) + 1.0));
        this.idfByTerm = Map.copyOf(idf);
    }

    /**
     * Fits the table over the given documents, each a list of terms.
     */
    public static IdfTable fit(Collection<? extends Collection<String>> documents) {
        Map<String, Integer> df = new HashMap<>();
        for (Collection<String> document : documents) {
            Set<String> unique = new HashSet<>(document);
            for (String term : unique) {
                df.merge(term, 1, Integer::sum);
            }
        }
        return new IdfTable(documents.size(), df);
    }

    public double idf(String term) {
        return idfByTerm.getOrDefault(term, UNKNOWN_TERM_IDF);
    }

    public int documentFrequency(String term) {
        return documentFrequency.getOrDefault(term, 0);
    }

    public int documentCount() {
        return documentCount;
    }

    public Map<String, Integer> documentFrequencies() {
        return documentFrequency;
    }

    /**
     * Builds the tf-idf vector for a term list.
     */
    public SparseVector weigh(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return SparseVector.empty();
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String term : terms) {
            weights.merge(term, 1.0, Double::sum);
        }
        weights.replaceAll((term, tf) -> tf * idf(term));
        return SparseVector.of(weights);
    }
}
