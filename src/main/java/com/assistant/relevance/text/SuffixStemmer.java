package com.assistant.relevance.text;

import java.util.List;

/**
 * Heuristic suffix stripper. The first suffix of the ordered list that matches is removed,
 * but only when at least {@value #MIN_STEM_LENGTH} characters remain.
 */
public class SuffixStemmer {

    static final int MIN_STEM_LENGTH = 3;

    private final List<String> suffixes;

    public SuffixStemmer(List<String> suffixes) {
        this.suffixes = List.copyOf(suffixes);
    }

    /**
     * Returns the stem of a normalized token, or the token itself when no suffix applies.
     */
    public String stem(String token) {
        if (token == null) {
            return "";
        }
        for (String suffix : suffixes) {
            if (token.length() < suffix.length() + MIN_STEM_LENGTH) {
                continue;
            }
            if (token.endsWith(suffix)) {
                return token.substring(0, token.length() - suffix.length());
            }
        }
        return token;
    }
}
