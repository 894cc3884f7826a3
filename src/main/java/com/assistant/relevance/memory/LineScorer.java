package com.assistant.relevance.memory;

import java.util.Locale;
import java.util.Optional;

/**
 * Keyword score of a memory line: substring and per-term hits, file-kind and chat-scope
 * bonuses, scaled by {@link TemporalDecay}.
 */
public class LineScorer {

    static final double SUBSTRING_BONUS = 8.0;
    static final double LONG_TERM_HIT = 1.3;
    static final double TERM_HIT = 1.0;
    static final double FULL_COVERAGE_BONUS = 2.5;
    static final double CONTINUITY_BONUS = 3.0;
    static final double LONG_TERM_FILE_BONUS = 1.0;
    static final double METADATA_CHAT_BONUS = 4.0;
    static final double PATH_CHAT_BONUS = 3.2;

    private static final int LONG_TERM_MIN_LENGTH = 6;
    private static final int MIN_SUBSTRING_QUERY_LENGTH = 3;

    private final TemporalDecay decay;

    public LineScorer(TemporalDecay decay) {
        this.decay = decay;
    }

    /**
     * Returns 0 when neither the whole query nor any term occurs in the line.
     */
    public double score(MemoryLine line, RecallQuery query) {
        String normalizedLine = line.normalized();
        String normalizedQuery = query.normalized();
        if (normalizedLine.isEmpty() || normalizedQuery.isEmpty()) {
            return 0.0;
        }

        double score = 0.0;
        if (normalizedQuery.length() >= MIN_SUBSTRING_QUERY_LENGTH && normalizedLine.contains(normalizedQuery)) {
            score += SUBSTRING_BONUS;
        }

        int matched = 0;
        for (String term : query.terms()) {
            if (term.length() < 2 || !normalizedLine.contains(term)) {
                continue;
            }
            matched++;
            score += term.length() >= LONG_TERM_MIN_LENGTH ? LONG_TERM_HIT : TERM_HIT;
        }
        if (matched == 0 && score == 0.0) {
            return 0.0;
        }
        if (matched > 0 && matched == query.terms().size()) {
            score += FULL_COVERAGE_BONUS;
        }

        String path = line.path().toLowerCase(Locale.ROOT);
        if (path.endsWith("continuity.md")) {
            score += CONTINUITY_BONUS;
        }
        if (path.equals("memory.md")) {
            score += LONG_TERM_FILE_BONUS;
        }

        Long chatId = query.chatId();
        if (chatId != null) {
            Optional<Long> fromMetadata = line.metadata().chatIdValue();
            if (fromMetadata.isPresent() && fromMetadata.get().equals(chatId)) {
                score += METADATA_CHAT_BONUS;
            } else if (MemoryLayout.parseChatIdFromPath(line.path()).filter(chatId::equals).isPresent()) {
                score += PATH_CHAT_BONUS;
            }
        }

        if (line.hasAge()) {
            score *= decay.factor(line.ageDays());
        }
        return score;
    }
}
