package com.assistant.relevance.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Optional;

/**
 * Structured trailer of a memory line ({@code | meta={...}}). Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"source", "role", "chatId", "userId"})
public record LineMetadata(String source, String role, Long chatId, Long userId) {

    public static LineMetadata empty() {
        return new LineMetadata(null, null, null, null);
    }

    public Optional<Long> chatIdValue() {
        return Optional.ofNullable(chatId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return source == null && role == null && chatId == null && userId == null;
    }
}
