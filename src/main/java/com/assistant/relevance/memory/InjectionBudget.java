package com.assistant.relevance.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Caps the total snippet characters handed to the prompt. Whole snippets are kept while
 * they fit; the first one that overflows is cut to the remaining room with a marker and
 * ends the list. When the room cannot hold the marker the overflowing snippet is dropped,
 * so a shortened snippet always ends with the marker.
 */
public final class InjectionBudget {

    private InjectionBudget() {
    }

    /**
     * @param candidates ranked candidates
     * @param maxChars   character budget, ignored when null or not positive
     */
    public static List<MemoryCandidate> apply(List<MemoryCandidate> candidates, Integer maxChars) {
        if (maxChars == null || maxChars <= 0) {
            return candidates;
        }
        int remaining = maxChars;
        List<MemoryCandidate> result = new ArrayList<>();
        for (MemoryCandidate candidate : candidates) {
            if (remaining <= 0) {
                break;
            }
            String snippet = candidate.snippet();
            if (snippet.length() <= remaining) {
                result.add(candidate);
                remaining -= snippet.length();
                continue;
            }
            if (remaining > Snippets.BLOCK_MARKER.length()) {
                String truncated = Snippets.truncateWithMarker(snippet, remaining);
                String head = truncated.substring(0, truncated.length() - Snippets.BLOCK_MARKER.length());
                if (!head.isBlank()) {
                    result.add(candidate.withSnippet(truncated));
                }
            }
            break;
        }
        return result;
    }
}
