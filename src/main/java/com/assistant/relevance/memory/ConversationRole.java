package com.assistant.relevance.memory;

import java.util.Locale;
import java.util.Optional;

/**
 * Speaker of a conversation turn.
 */
public enum ConversationRole {
    USER("user", "USER"),
    ASSISTANT("assistant", "ASSISTANT");

    private final String id;
    private final String tag;

    ConversationRole(String id, String tag) {
        this.id = id;
        this.tag = tag;
    }

    public String getId() {
        return id;
    }

    /**
     * Upper-case label written in front of the turn text.
     */
    public String getTag() {
        return tag;
    }

    public static Optional<ConversationRole> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        for (ConversationRole role : values()) {
            if (role.id.equals(key)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
