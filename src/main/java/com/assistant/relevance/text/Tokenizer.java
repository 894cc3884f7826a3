package com.assistant.relevance.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into searchable terms: surface tokens, their stems, word bigrams and
 * character n-grams. All methods are pure; the same input always yields the same
 * token sequence.
 */
public class Tokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z0-9ñü_-]{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int TRIGRAM = 3;

    private final TextNormalizer normalizer;
    private final LocaleProfile profile;
    private final SuffixStemmer stemmer;

    public Tokenizer() {
        this(new TextNormalizer(), LocaleProfile.spanish());
    }

    public Tokenizer(TextNormalizer normalizer, LocaleProfile profile) {
        this.normalizer = normalizer;
        this.profile = profile;
        this.stemmer = new SuffixStemmer(profile.suffixes());
    }

    public TextNormalizer getNormalizer() {
        return normalizer;
    }

    public LocaleProfile getProfile() {
        return profile;
    }

    /**
     * Surface tokens of the text, stopwords removed, in order of appearance.
     */
    public List<String> surfaceTokens(String text) {
        String normalized = normalizer.normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(normalized);
        while (matcher.find()) {
            String token = matcher.group();
            if (!profile.stopwords().contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Surface tokens, each followed by its stem when the stem differs and keeps
     * at least three characters.
     */
    public List<String> tokenize(String text) {
        List<String> surface = surfaceTokens(text);
        List<String> tokens = new ArrayList<>(surface.size() * 2);
        for (String token : surface) {
            tokens.add(token);
            String stem = stemmer.stem(token);
            if (stem.length() >= SuffixStemmer.MIN_STEM_LENGTH && !stem.equals(token)) {
                tokens.add(stem);
            }
        }
        return tokens;
    }

    /**
     * Distinct tokens (surface and stems) in first-seen order.
     */
    public Set<String> tokenSet(String text) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tokenize(text)));
    }

    /**
     * Tokens plus adjacent-pair tokens joined with an underscore.
     */
    public static List<String> withBigrams(List<String> tokens) {
        List<String> terms = new ArrayList<>(tokens);
        for (int i = 0; i < tokens.size() - 1; i++) {
            terms.add(tokens.get(i) + "_" + tokens.get(i + 1));
        }
        return terms;
    }

    /**
     * Overlapping 3-character windows of the canonical text with words joined by
     * underscores. Text shorter than three characters yields itself as the only gram.
     */
    public List<String> withCharTrigrams(String text) {
        String canonical = normalizer.canonicalize(text);
        if (canonical.isEmpty()) {
            return List.of();
        }
        String joined = WHITESPACE.matcher(canonical).replaceAll("_");
        if (joined.length() <= TRIGRAM) {
            return List.of(joined);
        }
        List<String> grams = new ArrayList<>(joined.length() - TRIGRAM + 1);
        for (int i = 0; i <= joined.length() - TRIGRAM; i++) {
            grams.add(joined.substring(i, i + TRIGRAM));
        }
        return grams;
    }

    /**
     * Set of character n-grams over the space-padded, whitespace-collapsed normalized text.
     */
    public Set<String> charNgramSet(String text, int n) {
        String normalized = WHITESPACE.matcher(normalizer.normalize(text)).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return Set.of();
        }
        String padded = " " + normalized + " ";
        if (padded.length() <= n) {
            return Set.of(padded);
        }
        Set<String> grams = new LinkedHashSet<>();
        for (int i = 0; i <= padded.length() - n; i++) {
            grams.add(padded.substring(i, i + n));
        }
        return grams;
    }
}
