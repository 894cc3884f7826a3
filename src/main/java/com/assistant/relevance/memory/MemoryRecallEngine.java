package com.assistant.relevance.memory;

import com.assistant.relevance.logging.LogContext;
import com.assistant.relevance.metrics.MetricsService;
import com.assistant.relevance.metrics.NoOpMetricsService;
import com.assistant.relevance.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Retrieves the most relevant memory lines for a query.
 *
 * <p>Each search indexes the in-scope files, scores them with the preferred backend and
 * falls back to keyword scan when it fails. Candidates are deduplicated, sorted, reordered
 * for diversity, cut to the character budget and finally to the limit.</p>
 *
 * <pre>
 * try (MemoryRecallEngine engine = MemoryRecallEngine.builder().workspace(dir).build()) {
 *     List&lt;MemoryHit&gt; hits = engine.search("pizza favorita",
 *             RecallOptions.builder().chatId(42L).limit(5).build());
 * }
 * </pre>
 */
public class MemoryRecallEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MemoryRecallEngine.class);

    private static final int DEFAULT_READ_THREADS = 4;

    private final RecallConfig config;
    private final MemoryLayout layout;
    private final Tokenizer tokenizer;
    private final MemoryCorpusLoader loader;
    private final Map<MemoryBackend, RecallBackend> backends;
    private final MmrReranker reranker;
    private final MetricsService metrics;
    private final ExecutorService ownedExecutor;

    private volatile MemoryBackend lastBackendUsed;
    private volatile String lastFallbackError;
    private final AtomicLong fallbackCount = new AtomicLong();

    private MemoryRecallEngine(Builder builder) {
        this.config = builder.config;
        this.layout = new MemoryLayout(builder.workspace);
        this.tokenizer = builder.tokenizer;
        this.metrics = builder.metrics;
        this.ownedExecutor = builder.executor == null ? newReadExecutor() : null;
        this.loader = new MemoryCorpusLoader(layout, tokenizer,
                builder.executor != null ? builder.executor : ownedExecutor, builder.clock);
        this.reranker = new MmrReranker();

        LineScorer lineScorer = new LineScorer(new TemporalDecay(config.halfLifeDays(), 0.65));
        this.backends = new EnumMap<>(MemoryBackend.class);
        backends.put(MemoryBackend.HYBRID,
                new HybridBackend(lineScorer, tokenizer, config.semanticMinScore(), config.snippetMaxChars()));
        backends.put(MemoryBackend.SCAN, new ScanBackend(lineScorer, tokenizer, config.snippetMaxChars()));
        backends.putAll(builder.backendOverrides);
        this.lastBackendUsed = config.backend();
    }

    // ========== Search ==========

    public List<MemoryHit> search(String query) {
        return search(query, RecallOptions.defaults());
    }

    /**
     * Searches memory. Never throws for bad input or failing backends; those yield an
     * empty list.
     *
     * @param query   free-form text
     * @param options limit, chat scope and character budget
     */
    public List<MemoryHit> search(String query, RecallOptions options) {
        Objects.requireNonNull(options, "options is required");
        RecallQuery prepared = RecallQuery.of(query, options.getChatId(), tokenizer);
        if (prepared.isEmpty()) {
            return List.of();
        }
        int limit = options.getLimit() != null ? options.getLimit() : config.maxResults();
        String chatScope = options.getChatId() != null ? String.valueOf(options.getChatId()) : null;

        try (LogContext ctx = LogContext.forRecall(LogContext.generateCorrelationId(), chatScope)) {
            List<MemoryLine> corpus = null;
            String lastError = null;
            for (MemoryBackend kind : backendOrder()) {
                long start = System.nanoTime();
                try {
                    if (corpus == null) {
                        corpus = loader.load(options.getChatId());
                    }
                    List<MemoryCandidate> candidates = backends.get(kind).search(prepared, corpus);
                    recordSuccess(kind, lastError);
                    List<MemoryHit> hits = finalizeHits(candidates, limit, options.getMaxInjectedChars());
                    metrics.recordRecallDuration(kind.getId(), Duration.ofNanos(System.nanoTime() - start));
                    metrics.recordRecallResults(hits.size());
                    log.debug("memory.search backend={} lines={} candidates={} hits={}",
                            kind, corpus.size(), candidates.size(), hits.size());
                    return hits;
                } catch (RuntimeException e) {
                    lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    log.warn("memory.backend.failed backend={} reason={}", kind, lastError);
                }
            }

            lastBackendUsed = MemoryBackend.SCAN;
            if (lastError != null) {
                fallbackCount.incrementAndGet();
                lastFallbackError = lastError;
                metrics.incrementRecallFallback(config.backend().getId());
            }
            return List.of();
        }
    }

    /**
     * Search sized for prompt injection: the configured result count and character budget.
     */
    public List<MemoryHit> searchForPrompt(String query, Long chatId) {
        return search(query, RecallOptions.builder()
                .chatId(chatId)
                .limit(config.maxResults())
                .maxInjectedChars(config.maxInjectedChars())
                .build());
    }

    private List<MemoryBackend> backendOrder() {
        return config.backend() == MemoryBackend.HYBRID
                ? List.of(MemoryBackend.HYBRID, MemoryBackend.SCAN)
                : List.of(MemoryBackend.SCAN);
    }

    private void recordSuccess(MemoryBackend kind, String lastError) {
        lastBackendUsed = kind;
        if (kind != config.backend()) {
            fallbackCount.incrementAndGet();
            lastFallbackError = lastError != null ? lastError : "fallback from " + config.backend();
            metrics.incrementRecallFallback(config.backend().getId());
        } else {
            lastFallbackError = null;
        }
    }

    List<MemoryHit> finalizeHits(List<MemoryCandidate> candidates, int limit, Integer maxInjectedChars) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, MemoryCandidate> deduped = new LinkedHashMap<>();
        for (MemoryCandidate candidate : candidates) {
            deduped.merge(candidate.dedupKey(), candidate,
                    (existing, incoming) -> incoming.score() > existing.score() ? incoming : existing);
        }
        List<MemoryCandidate> ranked = new ArrayList<>(deduped.values());
        ranked.sort(MmrReranker.SCORE_ORDER);

        // Repeated content keeps its best-ranked occurrence
        Map<String, MemoryCandidate> byContent = new LinkedHashMap<>();
        for (MemoryCandidate candidate : ranked) {
            byContent.putIfAbsent(candidate.contentKey(), candidate);
        }
        List<MemoryCandidate> sorted = new ArrayList<>(byContent.values());

        List<MemoryCandidate> reranked = reranker.rerank(sorted, limit);
        List<MemoryCandidate> budgeted = InjectionBudget.apply(reranked, maxInjectedChars);

        List<MemoryHit> hits = new ArrayList<>(Math.min(limit, budgeted.size()));
        for (MemoryCandidate candidate : budgeted) {
            if (hits.size() >= limit) {
                break;
            }
            hits.add(candidate.toHit());
        }
        return hits;
    }

    // ========== Status ==========

    public RecallStatus status() {
        return new RecallStatus(config.backend(), lastBackendUsed, fallbackCount.get(), lastFallbackError);
    }

    public RecallConfig getConfig() {
        return config;
    }

    public MemoryLayout getLayout() {
        return layout;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private static ExecutorService newReadExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "memory-read-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(DEFAULT_READ_THREADS, factory);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path workspace;
        private RecallConfig config = RecallConfig.defaults();
        private Tokenizer tokenizer;
        private MetricsService metrics;
        private Clock clock = Clock.systemUTC();
        private ExecutorService executor;
        private final Map<MemoryBackend, RecallBackend> backendOverrides = new EnumMap<>(MemoryBackend.class);

        public Builder workspace(Path workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder config(RecallConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        /**
         * Executor for file reads. The engine does not shut down a supplied executor.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Replaces the built-in implementation of one backend.
         */
        public Builder backend(RecallBackend backend) {
            Objects.requireNonNull(backend, "backend is required");
            this.backendOverrides.put(backend.kind(), backend);
            return this;
        }

        public MemoryRecallEngine build() {
            Objects.requireNonNull(workspace, "workspace is required");
            if (tokenizer == null) {
                tokenizer = new Tokenizer();
            }
            if (metrics == null) {
                metrics = new NoOpMetricsService();
            }
            return new MemoryRecallEngine(this);
        }
    }
}
