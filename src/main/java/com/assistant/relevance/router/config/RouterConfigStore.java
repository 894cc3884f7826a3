package com.assistant.relevance.router.config;

import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouterSettings;
import com.assistant.relevance.similarity.ScoringConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Loads and saves the router configuration as a JSON file:
 * {@code {version, updatedAt, hybridAlpha, minScoreGap, routes: [...]}}.
 */
public class RouterConfigStore {
    private static final Logger log = LoggerFactory.getLogger(RouterConfigStore.class);

    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RouterConfigStore(Path file) {
        this(file, Clock.systemUTC());
    }

    public RouterConfigStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file is required");
        this.clock = clock;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Loads the persisted configuration.
     *
     * @throws RouterConfigException if the file is missing, unreadable or holds no valid route
     */
    public RouterSettings load() {
        if (!Files.exists(file)) {
            throw new RouterConfigException("Router config not found: " + file);
        }
        RouterConfigDocument document;
        try {
            document = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8),
                    RouterConfigDocument.class);
        } catch (IOException e) {
            throw new RouterConfigException("Invalid router config " + file + ": " + e.getMessage(), e);
        }
        if (document == null || document.routes() == null) {
            throw new RouterConfigException("Router config " + file + " has no routes");
        }
        List<Route> routes = RouteEntries.toRoutes(document.routes());
        if (routes.isEmpty()) {
            throw new RouterConfigException("Router config " + file + " has no valid routes");
        }
        double alpha = document.hybridAlpha() != null
                ? document.hybridAlpha() : ScoringConfig.defaults().hybridAlpha();
        double gap = document.minScoreGap() != null
                ? document.minScoreGap() : RouterSettings.DEFAULT_MIN_SCORE_GAP;
        RouterSettings settings = new RouterSettings(routes, alpha, gap);
        log.info("router.config.loaded file={} routes={} hybridAlpha={} minScoreGap={}",
                file, routes.size(), settings.hybridAlpha(), settings.minScoreGap());
        return settings;
    }

    /**
     * Loads the configuration, or writes {@code current} and returns it when the file
     * is missing and {@code createIfMissing} is set.
     */
    public RouterSettings load(RouterSettings current, boolean createIfMissing) {
        if (!Files.exists(file)) {
            if (!createIfMissing) {
                throw new RouterConfigException("Router config not found: " + file);
            }
            save(current);
            log.info("router.config.created file={}", file);
            return current;
        }
        return load();
    }

    /**
     * Writes the full route set, creating parent directories as needed.
     */
    public void save(RouterSettings settings) {
        RouterConfigDocument document = new RouterConfigDocument(
                FORMAT_VERSION,
                Instant.now(clock).toString(),
                settings.hybridAlpha(),
                settings.minScoreGap(),
                RouteEntries.toEntries(settings.routes()));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(document) + "\n", StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new RouterConfigException("Failed to serialize router config: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RouterConfigException("Failed to write router config " + file + ": " + e.getMessage(), e);
        }
        log.info("router.config.saved file={} routes={}", file, settings.routes().size());
    }
}
