package com.assistant.relevance.memory;

import com.assistant.relevance.text.Tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * A prepared recall query.
 *
 * @param raw        trimmed query text
 * @param normalized accent- and case-folded query
 * @param terms      distinct query terms, each surface token followed by its stem
 * @param chatId     chat scope, null for none
 */
public record RecallQuery(String raw, String normalized, List<String> terms, Long chatId) {

    public RecallQuery {
        terms = List.copyOf(terms);
    }

    public static RecallQuery of(String text, Long chatId, Tokenizer tokenizer) {
        String raw = text == null ? "" : text.trim();
        return new RecallQuery(raw, tokenizer.getNormalizer().normalize(raw),
                new ArrayList<>(tokenizer.tokenSet(raw)), chatId);
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }
}
