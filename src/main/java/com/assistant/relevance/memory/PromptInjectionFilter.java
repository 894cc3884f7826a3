package com.assistant.relevance.memory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects memory lines that read like instructions aimed at the model rather than notes.
 */
public class PromptInjectionFilter {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("ignore (all|any|previous|above|prior) instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("do not follow (the )?(system|developer)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system prompt", Pattern.CASE_INSENSITIVE),
            Pattern.compile("developer message", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<\\s*(system|assistant|developer|tool|function|relevant-memories)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(run|execute|call|invoke)\\b.{0,40}\\b(tool|command)\\b", Pattern.CASE_INSENSITIVE)
    );

    private final List<Pattern> patterns;

    public PromptInjectionFilter() {
        this(DEFAULT_PATTERNS);
    }

    public PromptInjectionFilter(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public boolean looksLikeInjection(String text) {
        String compact = Snippets.collapseWhitespace(text);
        if (compact.isEmpty()) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(compact).find()) {
                return true;
            }
        }
        return false;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }
}
