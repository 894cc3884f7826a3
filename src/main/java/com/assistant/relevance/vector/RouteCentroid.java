package com.assistant.relevance.vector;

import java.util.Objects;

/**
 * Mean vectors of a route's positive and negative example utterances.
 */
public record RouteCentroid(
        SparseVector word,
        SparseVector chars,
        SparseVector negativeWord,
        SparseVector negativeChars
) {
    public RouteCentroid {
        Objects.requireNonNull(word, "word is required");
        Objects.requireNonNull(chars, "chars is required");
        Objects.requireNonNull(negativeWord, "negativeWord is required");
        Objects.requireNonNull(negativeChars, "negativeChars is required");
    }

    public boolean hasNegatives() {
        return !negativeWord.isEmpty() || !negativeChars.isEmpty();
    }
}
