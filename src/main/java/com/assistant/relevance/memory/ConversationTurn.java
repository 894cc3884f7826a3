package com.assistant.relevance.memory;

import java.util.Objects;

/**
 * One message to persist into memory.
 *
 * @param chatId chat the turn belongs to; non-positive ids skip the per-chat transcript
 * @param role   speaker
 * @param text   message text
 * @param source channel that produced the turn, e.g. {@code telegram}
 * @param userId sender id, optional
 */
public record ConversationTurn(long chatId, ConversationRole role, String text, String source, Long userId) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(text, "text is required");
    }

    public static ConversationTurn user(long chatId, String text) {
        return new ConversationTurn(chatId, ConversationRole.USER, text, null, null);
    }

    public static ConversationTurn assistant(long chatId, String text) {
        return new ConversationTurn(chatId, ConversationRole.ASSISTANT, text, null, null);
    }
}
