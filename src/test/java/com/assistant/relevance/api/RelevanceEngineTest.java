package com.assistant.relevance.api;

import com.assistant.relevance.memory.ConversationTurn;
import com.assistant.relevance.memory.FactUpsert;
import com.assistant.relevance.memory.MemoryBackend;
import com.assistant.relevance.memory.MemoryExcerpt;
import com.assistant.relevance.memory.MemoryHit;
import com.assistant.relevance.memory.RecallOptions;
import com.assistant.relevance.metrics.MicrometerMetricsService;
import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouteDecision;
import com.assistant.relevance.router.RouteName;
import com.assistant.relevance.router.RouterSettings;
import com.assistant.relevance.router.cache.DecisionCacheConfig;
import com.assistant.relevance.router.config.RouterConfigException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RelevanceEngine Tests")
class RelevanceEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path workspace;

    private static List<Route> mailAndWeb() {
        return List.of(
                Route.of(RouteName.GMAIL, 0.20, List.of("enviar correo", "leer inbox")),
                Route.of(RouteName.WEB, 0.30, List.of("buscar en internet", "noticias de hoy")));
    }

    private RelevanceEngine.Builder builder() {
        return RelevanceEngine.builder()
                .workspace(workspace)
                .decisionCacheConfig(DecisionCacheConfig.disabled())
                .clock(CLOCK);
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("Should route with the configured routes")
        void testRoute() {
            try (RelevanceEngine engine = builder()
                    .routerSettings(new RouterSettings(mailAndWeb(), 0.72, 0.03))
                    .build()) {

                Optional<RouteDecision> decision = engine.route("enviame un correo a x@y.com");

                assertTrue(decision.isPresent());
                assertEquals(RouteName.GMAIL, decision.get().handler());
                assertTrue(engine.route("asdkj qpwoe").isEmpty());
            }
        }

        @Test
        @DisplayName("Should write the current routes when the configuration file is missing")
        void testCreateConfig() {
            Path config = workspace.resolve("config/router.json");

            try (RelevanceEngine engine = builder()
                    .routerSettings(new RouterSettings(mailAndWeb(), 0.72, 0.03))
                    .routerConfig(config)
                    .build()) {

                assertTrue(Files.isRegularFile(config));
                assertEquals(2, engine.getRouter().getRoutes().size());
            }
        }

        @Test
        @DisplayName("Should fail for a missing configuration file when creation is off")
        void testMissingConfig() {
            Path config = workspace.resolve("router.json");

            assertThrows(RouterConfigException.class, () -> builder().routerConfig(config, false).build());
        }

        @Test
        @DisplayName("Should persist reloaded routes and read them back")
        void testReloadRoutes() {
            Path config = workspace.resolve("router.json");
            List<Route> gmailOnly = List.of(Route.of(RouteName.GMAIL, 0.25, List.of("enviar correo")));

            try (RelevanceEngine engine = builder()
                    .routerSettings(new RouterSettings(mailAndWeb(), 0.72, 0.03))
                    .routerConfig(config)
                    .build()) {
                engine.reloadRoutes(new RouterSettings(gmailOnly, 0.72, 0.03));
                assertEquals(1, engine.getRouter().getRoutes().size());
            }

            try (RelevanceEngine reopened = builder().routerConfig(config, false).build()) {
                assertEquals(List.of(RouteName.GMAIL),
                        reopened.getRouter().getRoutes().stream().map(Route::name).collect(Collectors.toList()));
                assertEquals(Optional.of(0.25), reopened.getRouter().getRouteThreshold(RouteName.GMAIL));
            }
        }

        @Test
        @DisplayName("Should refuse to reload from a file that was never attached")
        void testReloadWithoutConfig() {
            try (RelevanceEngine engine = builder().build()) {
                assertThrows(IllegalStateException.class, engine::reloadRoutesFromConfig);
            }
        }

        @Test
        @DisplayName("Should require a workspace")
        void testRequiresWorkspace() {
            assertThrows(IllegalStateException.class, () -> RelevanceEngine.builder().build());
        }
    }

    @Nested
    @DisplayName("Memory")
    class MemoryTests {

        @Test
        @DisplayName("Should recall a turn it just recorded")
        void testRecordThenRecall() {
            try (RelevanceEngine engine = builder().build()) {
                engine.appendConversationTurn(ConversationTurn.user(42, "mi pizza favorita es la napolitana"));
                engine.appendConversationTurn(ConversationTurn.assistant(42, "anotado"));

                List<MemoryHit> hits = engine.search("pizza favorita", RecallOptions.builder().chatId(42L).build());

                assertFalse(hits.isEmpty());
                assertTrue(hits.get(0).snippet().contains("mi pizza favorita es la napolitana"));
                assertEquals(MemoryBackend.HYBRID, engine.recallStatus().lastBackendUsed());
                assertEquals(0, engine.recallStatus().fallbackCount());
            }
        }

        @Test
        @DisplayName("Should recall long-term facts")
        void testFacts() {
            try (RelevanceEngine engine = builder().build()) {
                FactUpsert upsert = engine.upsertLongTermFact("equipo", "boca juniors", "chat", 42L, null);

                List<MemoryHit> hits = engine.searchForPrompt("equipo", 42L);

                assertEquals("equipo", upsert.key());
                assertFalse(hits.isEmpty());
                assertEquals("MEMORY.md", hits.get(0).path());
            }
        }

        @Test
        @DisplayName("Should read back daily notes")
        void testReadMemoryFile() {
            try (RelevanceEngine engine = builder().build()) {
                String relPath = engine.appendDailyNote("pagar el gas");

                MemoryExcerpt excerpt = engine.readMemoryFile(relPath, 1, 5);

                assertEquals("memory/2026-10-19.md", excerpt.path());
                assertTrue(excerpt.text().startsWith("- [12:00:00] pagar el gas"));
            }
        }

        @Test
        @DisplayName("Should rebuild the continuity snapshot on demand")
        void testFlushBeforeReasoning() throws IOException {
            try (RelevanceEngine engine = builder().build()) {
                engine.appendConversationTurn(ConversationTurn.user(7, "recordame revisar el informe"));
                Path snapshot = workspace.resolve("memory/chats/chat-7/CONTINUITY.md");
                Files.delete(snapshot);

                engine.flushBeforeReasoning(7);

                assertTrue(Files.readString(snapshot).contains("recordame revisar el informe"));
            }
        }

        @Test
        @DisplayName("Should record routing and recall meters")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            try (RelevanceEngine engine = builder()
                    .routerSettings(new RouterSettings(mailAndWeb(), 0.72, 0.03))
                    .metrics(new MicrometerMetricsService(registry))
                    .build()) {
                engine.appendDailyNote("comprar yerba mate");

                engine.route("enviar correo urgente");
                engine.search("yerba");

                assertFalse(registry.getMeters().isEmpty());
            }
        }
    }
}
