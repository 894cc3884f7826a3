package com.assistant.relevance.router.config;

import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouteName;
import com.assistant.relevance.router.RouterSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RouterConfigStore Tests")
class RouterConfigStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private RouterSettings settings() {
        return new RouterSettings(List.of(
                Route.of(RouteName.GMAIL, 0.27, List.of("enviar correo", "leer inbox")),
                Route.of(RouteName.WEB, 0.3, List.of("buscar en internet"))
                        .withNegativeUtterances(List.of("buscar archivo"))
                        .withAlphaOverride(0.6)),
                0.7, 0.05);
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("router.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("Save and load")
    class SaveLoadTests {

        @Test
        @DisplayName("Should restore the saved route set")
        void testSaveThenLoad() {
            RouterConfigStore store = new RouterConfigStore(tempDir.resolve("nested/dir/router.json"), CLOCK);
            store.save(settings());

            RouterSettings loaded = store.load();

            assertEquals(settings(), loaded);
        }

        @Test
        @DisplayName("Should write the format version and update time")
        void testDocumentHeader() throws IOException {
            RouterConfigStore store = new RouterConfigStore(tempDir.resolve("router.json"), CLOCK);
            store.save(settings());

            String json = Files.readString(store.getFile(), StandardCharsets.UTF_8);

            assertTrue(json.contains("\"version\" : 1"));
            assertTrue(json.contains("2024-05-01T10:00:00Z"));
            assertTrue(json.contains("\"negativeUtterances\""));
        }

        @Test
        @DisplayName("Should create the file from the current routes when missing")
        void testCreateIfMissing() {
            RouterConfigStore store = new RouterConfigStore(tempDir.resolve("router.json"), CLOCK);

            RouterSettings loaded = store.load(settings(), true);

            assertEquals(settings(), loaded);
            assertTrue(Files.exists(store.getFile()));
        }

        @Test
        @DisplayName("Should fail on a missing file without createIfMissing")
        void testMissingFile() {
            RouterConfigStore store = new RouterConfigStore(tempDir.resolve("router.json"), CLOCK);
            assertThrows(RouterConfigException.class, () -> store.load(settings(), false));
            assertThrows(RouterConfigException.class, store::load);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should drop unknown routes and routes without utterances")
        void testDropsInvalidRoutes() throws IOException {
            Path file = write("""
                    {"routes": [
                      {"name": "gmail", "threshold": 0.3, "utterances": ["enviar correo"]},
                      {"name": "telepathy", "threshold": 0.3, "utterances": ["lee mi mente"]},
                      {"name": "web", "threshold": 0.3, "utterances": []}
                    ]}
                    """);

            RouterSettings loaded = new RouterConfigStore(file).load();

            assertEquals(1, loaded.routes().size());
            assertEquals(RouteName.GMAIL, loaded.routes().get(0).name());
            assertEquals(RouterSettings.DEFAULT_MIN_SCORE_GAP, loaded.minScoreGap());
        }

        @Test
        @DisplayName("Should clamp thresholds and alpha overrides")
        void testClamping() throws IOException {
            Path file = write("""
                    {"hybridAlpha": 2.0, "routes": [
                      {"name": "gmail", "threshold": 5.0, "alpha": -1, "utterances": ["enviar correo"]}
                    ]}
                    """);

            RouterSettings loaded = new RouterConfigStore(file).load();

            assertEquals(Route.MAX_THRESHOLD, loaded.routes().get(0).threshold());
            assertEquals(0.05, loaded.routes().get(0).alphaOverride());
            assertEquals(0.95, loaded.hybridAlpha());
        }

        @Test
        @DisplayName("Should fail when no valid route remains")
        void testNoValidRoutes() throws IOException {
            Path file = write("{\"routes\": [{\"name\": \"telepathy\", \"threshold\": 0.3, \"utterances\": [\"x\"]}]}");
            assertThrows(RouterConfigException.class, () -> new RouterConfigStore(file).load());
        }

        @Test
        @DisplayName("Should fail on a known route without threshold")
        void testMissingThreshold() throws IOException {
            Path file = write("{\"routes\": [{\"name\": \"gmail\", \"utterances\": [\"enviar correo\"]}]}");
            assertThrows(RouterConfigException.class, () -> new RouterConfigStore(file).load());
        }

        @Test
        @DisplayName("Should wrap malformed JSON")
        void testMalformed() throws IOException {
            Path file = write("{not json");
            RouterConfigException error = assertThrows(RouterConfigException.class,
                    () -> new RouterConfigStore(file).load());
            assertNotNull(error.getCause());
        }
    }
}
