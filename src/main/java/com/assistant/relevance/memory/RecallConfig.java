package com.assistant.relevance.memory;

import java.util.Objects;

/**
 * Engine-level recall settings. Integer limits are clamped into their supported ranges.
 *
 * @param maxResults       default number of hits (1-20)
 * @param snippetMaxChars  per-line snippet length (80-2000)
 * @param maxInjectedChars prompt budget used by {@link MemoryRecallEngine#searchForPrompt} (300-30000)
 * @param backend          preferred backend
 * @param halfLifeDays     temporal decay half-life
 * @param semanticMinScore minimum overlap similarity that earns the hybrid semantic boost
 */
public record RecallConfig(
        int maxResults,
        int snippetMaxChars,
        int maxInjectedChars,
        MemoryBackend backend,
        double halfLifeDays,
        double semanticMinScore
) {
    public static final int DEFAULT_MAX_RESULTS = 6;
    public static final int DEFAULT_SNIPPET_MAX_CHARS = 320;
    public static final int DEFAULT_MAX_INJECTED_CHARS = 2200;
    public static final double DEFAULT_HALF_LIFE_DAYS = 21.0;
    public static final double DEFAULT_SEMANTIC_MIN_SCORE = 0.28;

    public RecallConfig {
        Objects.requireNonNull(backend, "backend is required");
        if (halfLifeDays <= 0.0) {
            throw new IllegalArgumentException("halfLifeDays must be > 0");
        }
        if (semanticMinScore < 0.0 || semanticMinScore > 1.0) {
            throw new IllegalArgumentException("semanticMinScore must be between 0.0 and 1.0");
        }
        maxResults = clamp(maxResults, 1, 20);
        snippetMaxChars = clamp(snippetMaxChars, 80, 2_000);
        maxInjectedChars = clamp(maxInjectedChars, 300, 30_000);
    }

    public static RecallConfig defaults() {
        return new RecallConfig(DEFAULT_MAX_RESULTS, DEFAULT_SNIPPET_MAX_CHARS, DEFAULT_MAX_INJECTED_CHARS,
                MemoryBackend.HYBRID, DEFAULT_HALF_LIFE_DAYS, DEFAULT_SEMANTIC_MIN_SCORE);
    }

    public RecallConfig withBackend(MemoryBackend backend) {
        return new RecallConfig(maxResults, snippetMaxChars, maxInjectedChars, backend, halfLifeDays, semanticMinScore);
    }

    public RecallConfig withSnippetMaxChars(int snippetMaxChars) {
        return new RecallConfig(maxResults, snippetMaxChars, maxInjectedChars, backend, halfLifeDays, semanticMinScore);
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
