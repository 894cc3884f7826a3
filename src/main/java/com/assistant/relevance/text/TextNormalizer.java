package com.assistant.relevance.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Diacritic stripping and lowercasing, followed by an ordered chain of
 * {@link NormalizationRule}s for the canonical (routing) form.
 *
 * <p>{@link #normalize(String)} only folds accents and case, which is what substring
 * matching over memory lines needs. {@link #canonicalize(String)} additionally runs the
 * rule chain, by default turning punctuation into spaces and collapsing whitespace.</p>
 */
public class TextNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final List<NormalizationRule> rules;

    public TextNormalizer() {
        this(defaultRules());
    }

    public TextNormalizer(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }

    /**
     * Strips diacritics (NFD + combining mark removal) and lowercases.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes and then applies the rule chain in priority order.
     */
    public String canonicalize(String text) {
        String result = normalize(text);
        if (result.isEmpty()) {
            return result;
        }
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }
        return result.trim();
    }

    /**
     * Punctuation to space, then whitespace collapse.
     */
    public static List<NormalizationRule> defaultRules() {
        return List.of(
                NormalizationRule.of("non-alphanumeric", "[^\\p{L}\\p{N}\\s]", " ", 10),
                NormalizationRule.of("collapse-whitespace", "\\s+", " ", 20));
    }
}
