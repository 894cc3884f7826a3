package com.assistant.relevance.memory;

/**
 * A turn recovered from a transcript line.
 */
public record ConversationExcerpt(ConversationRole role, String text) {
}
