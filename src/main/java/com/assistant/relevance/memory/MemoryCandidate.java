package com.assistant.relevance.memory;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A scored line on its way through dedup, reranking and the injection budget.
 *
 * @param path              workspace-relative file path
 * @param line              1-based line number
 * @param snippet           truncated line content
 * @param score             backend score
 * @param normalizedSnippet folded snippet, part of the dedup key
 * @param similarityTokens  surface tokens of the snippet, used for diversity
 */
public record MemoryCandidate(
        String path,
        int line,
        String snippet,
        double score,
        String normalizedSnippet,
        Set<String> similarityTokens
) {
    private static final Pattern TRANSCRIPT_STAMP = Pattern.compile("^-\\s*\\[\\d{2}:\\d{2}:\\d{2}\\]\\s*");

    public MemoryCandidate {
        similarityTokens = Set.copyOf(similarityTokens);
    }

    String dedupKey() {
        return path + "#L" + line + ":" + normalizedSnippet;
    }

    /**
     * Normalized snippet without its transcript timestamp. The same turn written at two
     * moments, or into both the global and the chat transcript, shares this key.
     */
    String contentKey() {
        return TRANSCRIPT_STAMP.matcher(normalizedSnippet).replaceFirst("");
    }

    MemoryCandidate withSnippet(String truncated) {
        return new MemoryCandidate(path, line, truncated, score, normalizedSnippet, similarityTokens);
    }

    MemoryHit toHit() {
        return new MemoryHit(path, line, snippet, score);
    }
}
