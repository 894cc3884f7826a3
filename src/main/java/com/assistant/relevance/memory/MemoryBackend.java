package com.assistant.relevance.memory;

import java.util.Locale;
import java.util.Optional;

/**
 * Recall backends, in the order they are tried when {@link #HYBRID} is preferred.
 */
public enum MemoryBackend {
    HYBRID("hybrid"),
    SCAN("scan");

    private final String id;

    MemoryBackend(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<MemoryBackend> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (MemoryBackend backend : values()) {
            if (backend.id.equals(key)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
