package com.assistant.relevance.memory;

import java.util.Objects;

/**
 * One recalled memory line.
 *
 * @param path    workspace-relative file path, forward slashes
 * @param line    1-based line number inside the file
 * @param snippet line content, possibly truncated with a marker
 * @param score   recall score, higher is more relevant
 */
public record MemoryHit(String path, int line, String snippet, double score) {

    public MemoryHit {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(snippet, "snippet is required");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1");
        }
    }
}
