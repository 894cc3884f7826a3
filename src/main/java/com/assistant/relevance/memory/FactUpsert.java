package com.assistant.relevance.memory;

/**
 * Outcome of {@link MemoryWriter#upsertLongTermFact}.
 *
 * @param path    file that holds the fact
 * @param key     normalized fact key
 * @param value   normalized fact value
 * @param updated true when an existing line was replaced, false when a line was added
 */
public record FactUpsert(String path, String key, String value, boolean updated) {
}
