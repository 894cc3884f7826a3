package com.assistant.relevance.vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Fitted word-space and character-space IDF tables for one training corpus.
 *
 * @param wordIdf IDF over word-space terms
 * @param charIdf IDF over character trigrams
 */
public record VectorSpace(IdfTable wordIdf, IdfTable charIdf) {

    public VectorSpace {
        Objects.requireNonNull(wordIdf, "wordIdf is required");
        Objects.requireNonNull(charIdf, "charIdf is required");
    }

    /**
     * Fits both tables over the given documents.
     */
    public static VectorSpace fit(Collection<TermDocument> documents) {
        List<List<String>> wordDocs = new ArrayList<>(documents.size());
        List<List<String>> charDocs = new ArrayList<>(documents.size());
        for (TermDocument document : documents) {
            wordDocs.add(document.wordTerms());
            charDocs.add(document.charTerms());
        }
        return new VectorSpace(IdfTable.fit(wordDocs), IdfTable.fit(charDocs));
    }

    public SparseVector wordVector(TermDocument document) {
        return wordIdf.weigh(document.wordTerms());
    }

    public SparseVector charVector(TermDocument document) {
        return charIdf.weigh(document.charTerms());
    }

    /**
     * Averages positive and negative document vectors into a route centroid.
     */
    public RouteCentroid centroid(List<TermDocument> positives, List<TermDocument> negatives) {
        return new RouteCentroid(
                SparseVector.mean(positives.stream().map(this::wordVector).toList()),
                SparseVector.mean(positives.stream().map(this::charVector).toList()),
                SparseVector.mean(negatives.stream().map(this::wordVector).toList()),
                SparseVector.mean(negatives.stream().map(this::charVector).toList())
        );
    }
}
