package com.assistant.relevance.memory;

/**
 * A line range read from a memory file.
 *
 * @param path workspace-relative path
 * @param from first line, 1-based
 * @param to   last line read, 1-based and inclusive, or {@code from - 1} when nothing was read
 * @param text the lines joined with newlines
 */
public record MemoryExcerpt(String path, int from, int to, String text) {
}
