package com.assistant.relevance.vector;

import com.assistant.relevance.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw text into {@link TermDocument}s. Word-space terms are the tokens and stems
 * of the text followed by bigrams of its surface tokens.
 */
public class VectorBuilder {

    private final Tokenizer tokenizer;

    public VectorBuilder(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public TermDocument document(String text) {
        String safe = text == null ? "" : text;
        return new TermDocument(safe, wordTerms(safe), tokenizer.withCharTrigrams(safe));
    }

    public List<String> wordTerms(String text) {
        List<String> surface = tokenizer.surfaceTokens(text);
        List<String> terms = new ArrayList<>(tokenizer.tokenize(text));
        List<String> withPairs = Tokenizer.withBigrams(surface);
        terms.addAll(withPairs.subList(surface.size(), withPairs.size()));
        return terms;
    }
}
