package com.assistant.relevance.similarity;

import com.assistant.relevance.text.TextNormalizer;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Adjusts the hybrid alpha per query. Short queries and queries carrying domain keywords
 * lean on the lexical signal; long and noisy queries lean on character trigrams.
 */
public class AdaptiveAlphaPolicy {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextNormalizer normalizer;
    private final Set<String> domainSignalKeywords;
    private final int shortQueryMaxTokens;
    private final double shortQueryBoost;
    private final double domainSignalBoost;
    private final int longQueryMinTokens;
    private final double longQueryPenalty;
    private final double noiseRatioThreshold;
    private final double noisePenalty;

    public AdaptiveAlphaPolicy(TextNormalizer normalizer, Set<String> domainSignalKeywords) {
        this(normalizer, domainSignalKeywords, 4, 0.08, 0.03, 16, 0.05, 0.22, 0.06);
    }

    public AdaptiveAlphaPolicy(TextNormalizer normalizer, Set<String> domainSignalKeywords,
                               int shortQueryMaxTokens, double shortQueryBoost, double domainSignalBoost,
                               int longQueryMinTokens, double longQueryPenalty,
                               double noiseRatioThreshold, double noisePenalty) {
        this.normalizer = normalizer;
        this.domainSignalKeywords = Set.copyOf(domainSignalKeywords);
        this.shortQueryMaxTokens = shortQueryMaxTokens;
        this.shortQueryBoost = shortQueryBoost;
        this.domainSignalBoost = domainSignalBoost;
        this.longQueryMinTokens = longQueryMinTokens;
        this.longQueryPenalty = longQueryPenalty;
        this.noiseRatioThreshold = noiseRatioThreshold;
        this.noisePenalty = noisePenalty;
    }

    /**
     * Returns the effective alpha for a query.
     *
     * @param baseAlpha  route override or global default
     * @param rawText    the query as received
     * @param tokenCount number of surface tokens of the query
     */
    public double adapt(double baseAlpha, String rawText, int tokenCount) {
        double alpha = ScoringConfig.clampAlpha(baseAlpha);
        if (tokenCount <= shortQueryMaxTokens) {
            alpha += shortQueryBoost;
        }
        if (hasDomainSignal(rawText)) {
            alpha += domainSignalBoost;
        }
        if (tokenCount >= longQueryMinTokens) {
            alpha -= longQueryPenalty;
        }
        if (noiseRatio(rawText) >= noiseRatioThreshold) {
            alpha -= noisePenalty;
        }
        return ScoringConfig.clampAlpha(alpha);
    }

    boolean hasDomainSignal(String rawText) {
        String canonical = normalizer.canonicalize(rawText);
        if (canonical.isEmpty()) {
            return false;
        }
        for (String word : canonical.split(" ")) {
            if (domainSignalKeywords.contains(word)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fraction of non-whitespace characters that are neither letters nor digits.
     */
    double noiseRatio(String rawText) {
        String compact = WHITESPACE.matcher(normalizer.normalize(rawText)).replaceAll("");
        if (compact.isEmpty()) {
            return 0.0;
        }
        int noisy = 0;
        for (int i = 0; i < compact.length(); i++) {
            if (!Character.isLetterOrDigit(compact.charAt(i))) {
                noisy++;
            }
        }
        return (double) noisy / compact.length();
    }
}
