package com.assistant.relevance.text;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite run over folded (accent-free, lowercase) text.
 * Lower priorities run first.
 *
 * @param name        rule name, used in trace logs
 * @param pattern     compiled pattern, Unicode character classes enabled
 * @param replacement replacement for every match
 * @param priority    position in the chain
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS),
                replacement, priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
