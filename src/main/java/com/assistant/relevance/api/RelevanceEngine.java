package com.assistant.relevance.api;

import com.assistant.relevance.memory.ContinuityBuilder;
import com.assistant.relevance.memory.ConversationTurn;
import com.assistant.relevance.memory.FactUpsert;
import com.assistant.relevance.memory.LineMetadata;
import com.assistant.relevance.memory.LineMetadataParser;
import com.assistant.relevance.memory.MemoryExcerpt;
import com.assistant.relevance.memory.MemoryHit;
import com.assistant.relevance.memory.MemoryRecallEngine;
import com.assistant.relevance.memory.MemoryWriter;
import com.assistant.relevance.memory.RecallConfig;
import com.assistant.relevance.memory.RecallOptions;
import com.assistant.relevance.memory.RecallStatus;
import com.assistant.relevance.metrics.MetricsService;
import com.assistant.relevance.metrics.NoOpMetricsService;
import com.assistant.relevance.router.RouteDecision;
import com.assistant.relevance.router.RouteOptions;
import com.assistant.relevance.router.RouterSettings;
import com.assistant.relevance.router.SemanticRouter;
import com.assistant.relevance.router.cache.DecisionCacheConfig;
import com.assistant.relevance.router.config.RouterConfigStore;
import com.assistant.relevance.similarity.ScoringConfig;
import com.assistant.relevance.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: intent routing and memory recall over one workspace.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (RelevanceEngine engine = RelevanceEngine.builder()
 *         .workspace(Path.of("/srv/assistant"))
 *         .routerConfig(Path.of("/srv/assistant/router.json"))
 *         .build()) {
 *
 *     Optional&lt;RouteDecision&gt; decision = engine.route("revisa mi correo");
 *     List&lt;MemoryHit&gt; hits = engine.search("pizza favorita",
 *             RecallOptions.builder().chatId(42L).build());
 * }
 * </pre>
 */
public class RelevanceEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelevanceEngine.class);

    private final SemanticRouter router;
    private final MemoryRecallEngine recall;
    private final MemoryWriter writer;
    private final ContinuityBuilder continuity;
    private final RouterConfigStore routerConfigStore;

    private RelevanceEngine(Builder builder) {
        this.routerConfigStore = builder.routerConfigPath != null
                ? new RouterConfigStore(builder.routerConfigPath, builder.clock) : null;

        RouterSettings settings = builder.routerSettings;
        if (routerConfigStore != null) {
            RouterSettings current = settings != null ? settings : RouterSettings.defaults();
            settings = routerConfigStore.load(current, builder.createRouterConfigIfMissing);
        }

        this.router = SemanticRouter.builder()
                .settings(settings)
                .scoringConfig(builder.scoringConfig)
                .tokenizer(builder.tokenizer)
                .decisionCacheConfig(builder.decisionCacheConfig)
                .metrics(builder.metrics)
                .build();

        this.recall = MemoryRecallEngine.builder()
                .workspace(builder.workspace)
                .config(builder.recallConfig)
                .tokenizer(builder.tokenizer)
                .metrics(builder.metrics)
                .clock(builder.clock)
                .build();

        LineMetadataParser metadataParser = new LineMetadataParser();
        this.continuity = new ContinuityBuilder(recall.getLayout(), builder.tokenizer, metadataParser, builder.clock);
        this.writer = new MemoryWriter(recall.getLayout(), metadataParser, continuity, builder.clock);

        log.info("RelevanceEngine initialized workspace={} routes={} backend={}",
                recall.getLayout().getRoot(), router.getRoutes().size(), builder.recallConfig.backend());
    }

    // ========== Routing API ==========

    public Optional<RouteDecision> route(String text) {
        return router.route(text);
    }

    public Optional<RouteDecision> route(String text, RouteOptions options) {
        return router.route(text, options);
    }

    /**
     * Replaces the route set, retrains and clears the decision cache. The new settings are
     * persisted when a router configuration file is attached.
     */
    public void reloadRoutes(RouterSettings settings) {
        router.retrain(settings);
        if (routerConfigStore != null) {
            routerConfigStore.save(router.getSettings());
        }
    }

    /**
     * Re-reads the attached router configuration file.
     *
     * @throws IllegalStateException when the engine was built without a configuration file
     */
    public void reloadRoutesFromConfig() {
        if (routerConfigStore == null) {
            throw new IllegalStateException("No router configuration file attached");
        }
        router.retrain(routerConfigStore.load());
    }

    public void clearCache() {
        router.clearCache();
    }

    // ========== Memory API ==========

    public List<MemoryHit> search(String query) {
        return recall.search(query);
    }

    public List<MemoryHit> search(String query, RecallOptions options) {
        return recall.search(query, options);
    }

    /**
     * Recall sized for prompt injection, scoped to a chat.
     */
    public List<MemoryHit> searchForPrompt(String query, Long chatId) {
        return recall.searchForPrompt(query, chatId);
    }

    public String appendDailyNote(String note) {
        return writer.appendDailyNote(note, LineMetadata.empty());
    }

    public String appendConversationTurn(ConversationTurn turn) {
        return writer.appendConversationTurn(turn);
    }

    public FactUpsert upsertLongTermFact(String key, String value, String source, Long chatId, Long userId) {
        return writer.upsertLongTermFact(key, value, source, chatId, userId);
    }

    public MemoryExcerpt readMemoryFile(String relPath, Integer fromLine, Integer lines) {
        return writer.readMemoryFile(relPath, fromLine, lines);
    }

    /**
     * Rebuilds the chat continuity snapshot ahead of a reasoning step.
     */
    public void flushBeforeReasoning(long chatId) {
        continuity.rebuild(chatId);
    }

    public RecallStatus recallStatus() {
        return recall.status();
    }

    // ========== Accessors ==========

    public SemanticRouter getRouter() {
        return router;
    }

    public MemoryRecallEngine getRecall() {
        return recall;
    }

    @Override
    public void close() {
        recall.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path workspace;
        private RouterSettings routerSettings;
        private Path routerConfigPath;
        private boolean createRouterConfigIfMissing = true;
        private ScoringConfig scoringConfig = ScoringConfig.defaults();
        private DecisionCacheConfig decisionCacheConfig = DecisionCacheConfig.defaults();
        private RecallConfig recallConfig = RecallConfig.defaults();
        private Tokenizer tokenizer;
        private MetricsService metrics;
        private Clock clock = Clock.systemUTC();

        /**
         * Root directory holding {@code MEMORY.md} and {@code memory/}.
         */
        public Builder workspace(Path workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder routerSettings(RouterSettings routerSettings) {
            this.routerSettings = routerSettings;
            return this;
        }

        /**
         * Loads routes from a JSON configuration file. When the file is missing the
         * current routes are written to it.
         */
        public Builder routerConfig(Path routerConfigPath) {
            return routerConfig(routerConfigPath, true);
        }

        public Builder routerConfig(Path routerConfigPath, boolean createIfMissing) {
            this.routerConfigPath = routerConfigPath;
            this.createRouterConfigIfMissing = createIfMissing;
            return this;
        }

        public Builder scoringConfig(ScoringConfig scoringConfig) {
            this.scoringConfig = Objects.requireNonNull(scoringConfig, "scoringConfig is required");
            return this;
        }

        public Builder decisionCacheConfig(DecisionCacheConfig decisionCacheConfig) {
            this.decisionCacheConfig = Objects.requireNonNull(decisionCacheConfig, "decisionCacheConfig is required");
            return this;
        }

        public Builder recallConfig(RecallConfig recallConfig) {
            this.recallConfig = Objects.requireNonNull(recallConfig, "recallConfig is required");
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

        public RelevanceEngine build() {
            if (workspace == null) {
                throw new IllegalStateException("workspace is required");
            }
            if (tokenizer == null) {
                tokenizer = new Tokenizer();
            }
            if (metrics == null) {
                metrics = new NoOpMetricsService();
            }
            return new RelevanceEngine(this);
        }
    }
}
