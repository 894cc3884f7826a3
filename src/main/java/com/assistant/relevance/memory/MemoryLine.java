package com.assistant.relevance.memory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One indexed, non-empty line of the memory corpus. Built per search and discarded.
 *
 * @param path           workspace-relative file path
 * @param lineNumber     1-based line number
 * @param content        line text with the metadata trailer removed
 * @param normalized     accent- and case-folded content
 * @param metadata       parsed trailer, {@link LineMetadata#empty()} when absent or malformed
 * @param ageDays        file age in days, negative when unknown
 * @param tokens         index tokens (surface and stems) in order
 * @param tokenSet       distinct index tokens
 * @param tokenFrequency count of each index token
 */
public record MemoryLine(
        String path,
        int lineNumber,
        String content,
        String normalized,
        LineMetadata metadata,
        double ageDays,
        List<String> tokens,
        Set<String> tokenSet,
        Map<String, Integer> tokenFrequency
) {
    public MemoryLine {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(content, "content is required");
        metadata = metadata != null ? metadata : LineMetadata.empty();
        tokens = List.copyOf(tokens);
        tokenSet = Set.copyOf(tokenSet);
        tokenFrequency = Map.copyOf(tokenFrequency);
    }

    public boolean hasAge() {
        return ageDays >= 0.0;
    }

    /**
     * Document length used by BM25, never below one.
     */
    public int length() {
        return Math.max(1, tokens.size());
    }
}
