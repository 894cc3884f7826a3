package com.assistant.relevance.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A text broken into word-space terms (tokens, stems, bigrams) and character trigrams.
 *
 * @param text       the original text
 * @param wordTerms  word-space terms
 * @param charTerms  character trigram terms
 */
public record TermDocument(String text, List<String> wordTerms, List<String> charTerms) {

    public TermDocument {
        Objects.requireNonNull(text, "text is required");
        wordTerms = List.copyOf(wordTerms);
        charTerms = List.copyOf(charTerms);
    }

    /**
     * Raw term counts of the word-space terms.
     */
    public Map<String, Integer> wordFrequencies() {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String term : wordTerms) {
            frequencies.merge(term, 1, Integer::sum);
        }
        return Collections.unmodifiableMap(frequencies);
    }

    public int length() {
        return wordTerms.size();
    }

    public boolean isEmpty() {
        return wordTerms.isEmpty() && charTerms.isEmpty();
    }
}
