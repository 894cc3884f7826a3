package com.assistant.relevance.router;

import java.util.Optional;

/**
 * Handling domains the router can classify text into.
 */
public enum RouteName {
    STOIC_SMALLTALK("stoic-smalltalk"),
    SELF_MAINTENANCE("self-maintenance"),
    CONNECTOR("connector"),
    SCHEDULE("schedule"),
    MEMORY("memory"),
    GMAIL_RECIPIENTS("gmail-recipients"),
    GMAIL("gmail"),
    WORKSPACE("workspace"),
    DOCUMENT("document"),
    WEB("web");

    private final String id;

    RouteName(String id) {
        this.id = id;
    }

    /**
     * External identifier used in persisted configuration and datasets.
     */
    public String getId() {
        return id;
    }

    /**
     * Resolves an external identifier; unknown or blank identifiers give empty.
     */
    public static Optional<RouteName> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String trimmed = id.trim();
        for (RouteName name : values()) {
            if (name.id.equals(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
