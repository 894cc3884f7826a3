package com.assistant.relevance.memory;

/**
 * Backend telemetry of a {@link MemoryRecallEngine}.
 *
 * @param preferred         configured backend
 * @param lastBackendUsed   backend that served the last search
 * @param fallbackCount     searches served by a non-preferred backend, or by none
 * @param lastFallbackError message of the last backend failure, null after a clean preferred search
 */
public record RecallStatus(
        MemoryBackend preferred,
        MemoryBackend lastBackendUsed,
        long fallbackCount,
        String lastFallbackError
) {
}
