package com.assistant.relevance.router;

import com.assistant.relevance.logging.LogContext;
import com.assistant.relevance.metrics.MetricsService;
import com.assistant.relevance.metrics.NoOpMetricsService;
import com.assistant.relevance.router.cache.CachedDecision;
import com.assistant.relevance.router.cache.CaffeineDecisionCache;
import com.assistant.relevance.router.cache.DecisionCache;
import com.assistant.relevance.router.cache.DecisionCacheConfig;
import com.assistant.relevance.router.cache.DecisionCacheKey;
import com.assistant.relevance.router.cache.NoOpDecisionCache;
import com.assistant.relevance.router.calibration.CalibrationOptions;
import com.assistant.relevance.router.calibration.CalibrationReport;
import com.assistant.relevance.router.calibration.DatasetEvaluation;
import com.assistant.relevance.router.calibration.ThresholdOptimizer;
import com.assistant.relevance.router.config.RouterConfigException;
import com.assistant.relevance.similarity.AdaptiveAlphaPolicy;
import com.assistant.relevance.similarity.Bm25Scorer;
import com.assistant.relevance.similarity.HybridRouteScorer;
import com.assistant.relevance.similarity.ScoringConfig;
import com.assistant.relevance.text.Tokenizer;
import com.assistant.relevance.vector.RouteCentroid;
import com.assistant.relevance.vector.SparseVector;
import com.assistant.relevance.vector.TermDocument;
import com.assistant.relevance.vector.VectorBuilder;
import com.assistant.relevance.vector.VectorSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Classifies free-form text into one of a fixed set of routes.
 *
 * <p>Each route is trained from its example utterances into word and character-trigram
 * centroids. A query is scored against every allowed route with the hybrid scorer; the
 * best route is accepted only when it clears its own threshold and leads the runner-up
 * by the minimum gap. Every outcome, including "no route", is memoized in the decision
 * cache.</p>
 *
 * <pre>
 * SemanticRouter router = SemanticRouter.builder().build();
 * Optional&lt;RouteDecision&gt; decision = router.route("enviame un correo",
 *         RouteOptions.builder().allowed(RouteName.GMAIL, RouteName.WEB).build());
 * </pre>
 *
 * <p>Routing is thread-safe. Mutations (retrain, calibration, negative mining) replace the
 * trained model atomically and must not run concurrently with each other.</p>
 */
public class SemanticRouter {
    private static final Logger log = LoggerFactory.getLogger(SemanticRouter.class);

    static final int MIN_NORMALIZED_LENGTH = 3;
    static final int MIN_NEGATIVE_LENGTH = 6;
    static final int MAX_NEGATIVE_LENGTH = 220;

    private final Tokenizer tokenizer;
    private final VectorBuilder vectorBuilder;
    private final HybridRouteScorer scorer;
    private final AdaptiveAlphaPolicy alphaPolicy;
    private final DecisionCache decisionCache;
    private final MetricsService metrics;

    private volatile TrainedModel model;

    private SemanticRouter(Builder builder) {
        this.tokenizer = builder.tokenizer;
        this.vectorBuilder = new VectorBuilder(tokenizer);
        this.scorer = new HybridRouteScorer(builder.scoringConfig);
        this.alphaPolicy = new AdaptiveAlphaPolicy(tokenizer.getNormalizer(),
                tokenizer.getProfile().domainSignalKeywords());
        this.decisionCache = builder.decisionCache;
        this.metrics = builder.metrics;
        RouterSettings settings = builder.settings != null ? builder.settings
                : new RouterSettings(DefaultRoutes.routes(), builder.scoringConfig.hybridAlpha(),
                RouterSettings.DEFAULT_MIN_SCORE_GAP);
        this.model = train(settings);
    }

    // ========== Classification ==========

    public Optional<RouteDecision> route(String text) {
        return route(text, RouteOptions.defaults());
    }

    /**
     * Classifies one input.
     *
     * @param text    raw utterance
     * @param options candidate restriction, boosts, alpha overrides, topK and min gap
     * @return the accepted decision, or empty when no route qualifies
     */
    public Optional<RouteDecision> route(String text, RouteOptions options) {
        Objects.requireNonNull(options, "options is required");
        String normalized = tokenizer.getNormalizer().canonicalize(text);
        if (normalized.length() < MIN_NORMALIZED_LENGTH) {
            return Optional.empty();
        }
        TrainedModel current = model;
        double minGap = options.getMinGap() != null ? options.getMinGap() : current.settings().minScoreGap();
        DecisionCacheKey key = DecisionCacheKey.of(normalized, options, minGap);

        Optional<CachedDecision> cached = decisionCache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get().asOptional();
        }
        metrics.recordCacheMiss();

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRoute(LogContext.generateCorrelationId())) {
            List<RouteScore> scored = scoreAll(current, text, options);
            Optional<RouteDecision> decision = decide(current, scored, minGap, options.getTopK());
            decisionCache.put(key, decision.orElse(null));
            metrics.recordRouteDuration(Duration.ofNanos(System.nanoTime() - start));
            if (decision.isPresent()) {
                metrics.incrementRouteAccepted(decision.get().handler());
                metrics.recordRouteScore(decision.get().score());
                log.debug("router.decision handler={} score={} alternatives={}",
                        decision.get().handler(), decision.get().score(), decision.get().alternatives().size());
            } else {
                metrics.incrementRouteRejected();
                log.debug("router.rejected candidates={} best={}", scored.size(),
                        scored.isEmpty() ? "none" : scored.get(0));
            }
            return decision;
        }
    }

    /**
     * Scores every allowed route, best first. Ties keep route order.
     */
    public List<RouteScore> scoreAll(String text, RouteOptions options) {
        return scoreAll(model, text, options);
    }

    private List<RouteScore> scoreAll(TrainedModel current, String text, RouteOptions options) {
        TermDocument query = vectorBuilder.document(text);
        SparseVector queryWord = current.space().wordVector(query);
        SparseVector queryChars = current.space().charVector(query);
        int tokenCount = tokenizer.surfaceTokens(text).size();
        double globalAlpha = current.settings().hybridAlpha();

        List<RouteScore> scored = new ArrayList<>();
        for (Route route : current.settings().routes()) {
            if (!options.isAllowed(route.name())) {
                continue;
            }
            double baseAlpha = options.getAlphaOverrides().getOrDefault(route.name(),
                    route.alphaOverride() != null ? route.alphaOverride() : globalAlpha);
            double alpha = alphaPolicy.adapt(baseAlpha, text, tokenCount);
            double boost = options.getBoosts().getOrDefault(route.name(), 0.0);
            HybridRouteScorer.ScoreBreakdown breakdown = scorer.score(query, queryWord, queryChars,
                    current.centroids().get(route.name()), current.documents().get(route.name()),
                    current.corpus(), alpha, boost);
            scored.add(new RouteScore(route.name(), breakdown.hybrid()));
        }
        scored.sort(Comparator.comparingDouble(RouteScore::score).reversed());
        return scored;
    }

    private static Optional<RouteDecision> decide(TrainedModel current, List<RouteScore> scored,
                                                  double minGap, int topK) {
        Optional<RouteName> accepted = accept(scored, current.thresholds(), minGap);
        if (accepted.isEmpty()) {
            return Optional.empty();
        }
        RouteScore best = scored.get(0);
        double threshold = current.thresholds().get(best.name());
        String reason;
        if (scored.size() > 1) {
            reason = String.format(Locale.ROOT, "semantic score %.4f >= threshold %.2f and gap %.4f >= %.2f",
                    best.score(), threshold, best.score() - scored.get(1).score(), minGap);
        } else {
            reason = String.format(Locale.ROOT, "semantic score %.4f >= threshold %.2f", best.score(), threshold);
        }
        List<RouteScore> alternatives = scored.subList(0, Math.min(topK, scored.size()));
        return Optional.of(new RouteDecision(best.name(), best.score(), reason, alternatives));
    }

    /**
     * The acceptance gate: the best route wins when it reaches its threshold and leads
     * the second-best score by at least {@code minGap}.
     */
    static Optional<RouteName> accept(List<RouteScore> scored, Map<RouteName, Double> thresholds, double minGap) {
        if (scored.isEmpty()) {
            return Optional.empty();
        }
        RouteScore best = scored.get(0);
        Double threshold = thresholds.get(best.name());
        if (threshold == null || best.score() < threshold) {
            return Optional.empty();
        }
        if (scored.size() > 1 && best.score() - scored.get(1).score() < minGap) {
            return Optional.empty();
        }
        return Optional.of(best.name());
    }

    // ========== Training ==========

    private TrainedModel train(RouterSettings settings) {
        List<Route> routes = new ArrayList<>();
        Set<RouteName> seen = new HashSet<>();
        for (Route route : settings.routes()) {
            if (!route.hasUtterances()) {
                log.warn("router.train.route.skipped route={} reason=no-utterances", route.name());
                continue;
            }
            if (!seen.add(route.name())) {
                log.warn("router.train.route.skipped route={} reason=duplicate", route.name());
                continue;
            }
            routes.add(route);
        }
        if (routes.isEmpty()) {
            throw new RouterConfigException("Router has no route with utterances");
        }

        Map<RouteName, List<TermDocument>> positives = new EnumMap<>(RouteName.class);
        Map<RouteName, List<TermDocument>> negatives = new EnumMap<>(RouteName.class);
        List<TermDocument> allPositives = new ArrayList<>();
        for (Route route : routes) {
            List<TermDocument> docs = route.utterances().stream().map(vectorBuilder::document).toList();
            positives.put(route.name(), docs);
            negatives.put(route.name(), route.negativeUtterances().stream().map(vectorBuilder::document).toList());
            allPositives.addAll(docs);
        }

        VectorSpace space = VectorSpace.fit(allPositives);
        Map<RouteName, RouteCentroid> centroids = new EnumMap<>(RouteName.class);
        Map<RouteName, Double> thresholds = new EnumMap<>(RouteName.class);
        for (Route route : routes) {
            centroids.put(route.name(), space.centroid(positives.get(route.name()), negatives.get(route.name())));
            thresholds.put(route.name(), route.threshold());
        }

        List<Set<String>> termSets = new ArrayList<>(allPositives.size());
        List<Integer> lengths = new ArrayList<>(allPositives.size());
        for (TermDocument document : allPositives) {
            termSets.add(Set.copyOf(document.wordTerms()));
            lengths.add(document.length());
        }
        Bm25Scorer.CorpusStats corpus = Bm25Scorer.CorpusStats.of(termSets, lengths, null);

        log.info("router.trained routes={} documents={} wordTerms={}",
                routes.size(), allPositives.size(), space.wordIdf().documentFrequencies().size());
        return new TrainedModel(settings.withRoutes(routes), space, centroids, positives, thresholds, corpus);
    }

    /**
     * Replaces the whole route set and retrains. Clears the decision cache.
     *
     * @throws RouterConfigException when no route has utterances
     */
    public synchronized void retrain(RouterSettings settings) {
        Objects.requireNonNull(settings, "settings is required");
        this.model = train(settings);
        clearCache();
    }

    public RouterSettings getSettings() {
        return model.settings();
    }

    public List<Route> getRoutes() {
        return model.settings().routes();
    }

    public Optional<Double> getRouteThreshold(RouteName name) {
        return Optional.ofNullable(model.thresholds().get(name));
    }

    /**
     * Current thresholds in route order.
     */
    public Map<RouteName, Double> listRouteThresholds() {
        Map<RouteName, Double> thresholds = new LinkedHashMap<>();
        for (Route route : model.settings().routes()) {
            thresholds.put(route.name(), route.threshold());
        }
        return Collections.unmodifiableMap(thresholds);
    }

    public void clearCache() {
        decisionCache.invalidateAll();
    }

    public DecisionCache getDecisionCache() {
        return decisionCache;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    // ========== Dataset operations ==========

    /**
     * Accuracy of the current router over a labeled dataset. Samples whose expected
     * route is unknown are ignored.
     */
    public DatasetEvaluation evaluateDataset(Collection<LabeledSample> samples) {
        TrainedModel current = model;
        List<ScoredSample> scored = scoreSamples(current, usable(samples));
        return new DatasetEvaluation(scored.size(),
                countCorrect(scored, current.thresholds(), current.settings().minScoreGap()));
    }

    public CalibrationReport fitThresholdsFromDataset(Collection<LabeledSample> samples) {
        return fitThresholdsFromDataset(samples, CalibrationOptions.defaults());
    }

    /**
     * Fits per-route thresholds against a labeled dataset. Needs at least
     * {@link CalibrationOptions#getMinSamples()} usable samples, otherwise nothing changes.
     * Accuracy never decreases.
     */
    public synchronized CalibrationReport fitThresholdsFromDataset(Collection<LabeledSample> samples,
                                                                   CalibrationOptions options) {
        try (LogContext ctx = LogContext.forCalibration(LogContext.generateCorrelationId())) {
            TrainedModel current = model;
            List<LabeledSample> labeled = usable(samples);
            List<ScoredSample> scored = scoreSamples(current, labeled);
            double minGap = current.settings().minScoreGap();
            Map<RouteName, Double> before = listRouteThresholds();
            ToDoubleFunction<Map<RouteName, Double>> objective = thresholds -> accuracy(scored, thresholds, minGap);

            if (labeled.size() < options.getMinSamples()) {
                log.info("calibration.skipped labeled={} required={}", labeled.size(), options.getMinSamples());
                return CalibrationReport.unchanged(labeled.size(), objective.applyAsDouble(before), before);
            }

            ThresholdOptimizer optimizer = new ThresholdOptimizer(options);
            Map<RouteName, List<Double>> candidates = new LinkedHashMap<>();
            for (Map.Entry<RouteName, Double> entry : before.entrySet()) {
                List<Double> ownScores = new ArrayList<>();
                for (ScoredSample sample : scored) {
                    if (sample.expected() == entry.getKey()) {
                        ownScores.add(sample.scoreOf(entry.getKey()));
                    }
                }
                candidates.put(entry.getKey(), optimizer.candidates(entry.getValue(), ownScores));
            }

            ThresholdOptimizer.Result result = optimizer.optimize(before, candidates, objective);
            if (result.improved()) {
                Map<RouteName, Double> fitted = result.thresholds();
                List<Route> updated = current.settings().routes().stream()
                        .map(route -> route.withThreshold(fitted.get(route.name())))
                        .toList();
                this.model = train(current.settings().withRoutes(updated));
            }
            clearCache();
            metrics.recordCalibration(result.initialAccuracy(), result.accuracy());
            log.info("calibration.completed labeled={} before={} after={} improved={}",
                    labeled.size(), result.initialAccuracy(), result.accuracy(), result.improved());
            return new CalibrationReport(labeled.size(), result.initialAccuracy(), result.accuracy(),
                    result.improved(), before, listRouteThresholds());
        }
    }

    /**
     * Records mispredicted samples as negative examples of the route they were wrongly
     * pulled toward, then retrains.
     *
     * @param samples     labeled samples
     * @param maxPerRoute maximum negatives added per route in this call
     * @return number of negatives added per route
     */
    public synchronized Map<RouteName, Integer> augmentNegativesFromDataset(Collection<LabeledSample> samples,
                                                                          int maxPerRoute) {
        if (maxPerRoute <= 0) {
            throw new IllegalArgumentException("maxPerRoute must be positive");
        }
        TrainedModel current = model;
        Map<RouteName, List<String>> negatives = new EnumMap<>(RouteName.class);
        Map<RouteName, Set<String>> known = new EnumMap<>(RouteName.class);
        for (Route route : current.settings().routes()) {
            negatives.put(route.name(), new ArrayList<>(route.negativeUtterances()));
            Set<String> existing = new HashSet<>();
            route.negativeUtterances().forEach(n -> existing.add(tokenizer.getNormalizer().canonicalize(n)));
            route.utterances().forEach(u -> existing.add(tokenizer.getNormalizer().canonicalize(u)));
            known.put(route.name(), existing);
        }

        Map<RouteName, Integer> added = new EnumMap<>(RouteName.class);
        for (LabeledSample sample : usable(samples)) {
            String normalized = tokenizer.getNormalizer().canonicalize(sample.text());
            if (normalized.length() < MIN_NEGATIVE_LENGTH || normalized.length() > MAX_NEGATIVE_LENGTH) {
                continue;
            }
            List<RouteScore> scored = scoreAll(current, sample.text(), RouteOptions.defaults());
            if (scored.isEmpty() || scored.get(0).score() <= 0.0) {
                continue;
            }
            RouteName predicted = scored.get(0).name();
            RouteName expected = sample.expected().orElseThrow();
            if (predicted == expected) {
                continue;
            }
            if (added.getOrDefault(predicted, 0) >= maxPerRoute) {
                continue;
            }
            if (!known.get(predicted).add(normalized)) {
                continue;
            }
            negatives.get(predicted).add(normalized);
            added.merge(predicted, 1, Integer::sum);
        }

        if (!added.isEmpty()) {
            List<Route> updated = current.settings().routes().stream()
                    .map(route -> route.withNegativeUtterances(negatives.get(route.name())))
                    .toList();
            this.model = train(current.settings().withRoutes(updated));
            clearCache();
        }
        log.info("router.negatives.augmented added={}", added);
        return Collections.unmodifiableMap(added);
    }

    private static List<LabeledSample> usable(Collection<LabeledSample> samples) {
        return samples.stream().filter(Objects::nonNull).filter(LabeledSample::isUsable).toList();
    }

    private List<ScoredSample> scoreSamples(TrainedModel current, List<LabeledSample> samples) {
        List<ScoredSample> scored = new ArrayList<>(samples.size());
        for (LabeledSample sample : samples) {
            String normalized = tokenizer.getNormalizer().canonicalize(sample.text());
            List<RouteScore> scores = normalized.length() < MIN_NORMALIZED_LENGTH
                    ? List.of() : scoreAll(current, sample.text(), RouteOptions.defaults());
            scored.add(new ScoredSample(sample.expected().orElseThrow(), scores));
        }
        return scored;
    }

    private static double accuracy(List<ScoredSample> samples, Map<RouteName, Double> thresholds, double minGap) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        return (double) countCorrect(samples, thresholds, minGap) / samples.size();
    }

    private static int countCorrect(List<ScoredSample> samples, Map<RouteName, Double> thresholds, double minGap) {
        int correct = 0;
        for (ScoredSample sample : samples) {
            Optional<RouteName> accepted = accept(sample.scores(), thresholds, minGap);
            if (accepted.isPresent() && accepted.get() == sample.expected()) {
                correct++;
            }
        }
        return correct;
    }

    /**
     * A labeled sample with its precomputed route scores. Thresholds do not influence
     * scores, so calibration evaluates threshold assignments without rescoring.
     */
    private record ScoredSample(RouteName expected, List<RouteScore> scores) {
        double scoreOf(RouteName name) {
            for (RouteScore score : scores) {
                if (score.name() == name) {
                    return score.score();
                }
            }
            return 0.0;
        }
    }

    /**
     * Immutable training state, swapped atomically.
     */
    private record TrainedModel(
            RouterSettings settings,
            VectorSpace space,
            Map<RouteName, RouteCentroid> centroids,
            Map<RouteName, List<TermDocument>> documents,
            Map<RouteName, Double> thresholds,
            Bm25Scorer.CorpusStats corpus
    ) {}

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RouterSettings settings;
        private ScoringConfig scoringConfig = ScoringConfig.defaults();
        private Tokenizer tokenizer;
        private DecisionCache decisionCache;
        private MetricsService metrics;

        /**
         * Routes and gating parameters. Defaults to the built-in route set.
         */
        public Builder settings(RouterSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder routes(List<Route> routes) {
            this.settings = new RouterSettings(routes, scoringConfig.hybridAlpha(), RouterSettings.DEFAULT_MIN_SCORE_GAP);
            return this;
        }

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = Objects.requireNonNull(scoringConfig, "scoringConfig is required");
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        public Builder decisionCache(DecisionCache decisionCache) {
            this.decisionCache = decisionCache;
            return this;
        }

        /**
         * Uses a Caffeine decision cache with the given configuration.
         */
        public Builder decisionCacheConfig(DecisionCacheConfig config) {
            this.decisionCache = config.enabled() ? new CaffeineDecisionCache(config) : new NoOpDecisionCache();
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public SemanticRouter build() {
            if (tokenizer == null) {
                tokenizer = new Tokenizer();
            }
            if (decisionCache == null) {
                decisionCache = new CaffeineDecisionCache(DecisionCacheConfig.defaults());
            }
            if (metrics == null) {
                metrics = new NoOpMetricsService();
            }
            return new SemanticRouter(this);
        }
    }
}
