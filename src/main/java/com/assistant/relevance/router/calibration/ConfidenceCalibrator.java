package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.RouteName;
import com.assistant.relevance.router.config.RouterConfigException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw route scores to empirical precision with per-route histogram binning.
 *
 * <p>A route needs at least {@value #MIN_ROUTE_SUPPORT} samples and the score's bin at least
 * {@value #MIN_BIN_TOTAL} samples; otherwise the clamped raw score is returned.</p>
 */
public class ConfidenceCalibrator {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceCalibrator.class);

    static final int MIN_BINS = 5;
    static final int MAX_BINS = 20;
    static final int MIN_ROUTE_SUPPORT = 8;
    static final int MIN_BIN_TOTAL = 3;

    private final int bins;
    private final Map<RouteName, RouteState> byRoute = new EnumMap<>(RouteName.class);
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Clock clock;

    public ConfidenceCalibrator() {
        this(10);
    }

    public ConfidenceCalibrator(int bins) {
        this(bins, Clock.systemUTC());
    }

    public ConfidenceCalibrator(int bins, Clock clock) {
        this.bins = Math.max(MIN_BINS, Math.min(MAX_BINS, bins));
        this.clock = clock;
    }

    public int getBins() {
        return bins;
    }

    /**
     * Rebuilds every route histogram from the samples.
     */
    public synchronized void fit(List<CalibrationSample> samples) {
        byRoute.clear();
        for (CalibrationSample sample : samples) {
            RouteState state = byRoute.computeIfAbsent(sample.predictedRoute(), r -> RouteState.empty(bins));
            Bin bin = state.bins().get(bucket(clamp01(sample.score()), state.bins().size()));
            bin.total++;
            if (sample.isCorrect()) {
                bin.correct++;
            }
            state.support++;
        }
        log.info("confidence.fitted samples={} routes={} bins={}", samples.size(), byRoute.size(), bins);
    }

    /**
     * Returns the calibrated confidence of a score for a route.
     */
    public synchronized double calibrate(RouteName route, double score) {
        double safe = clamp01(score);
        RouteState state = byRoute.get(route);
        if (state == null || state.support < MIN_ROUTE_SUPPORT || state.bins().isEmpty()) {
            return safe;
        }
        Bin bin = state.bins().get(bucket(safe, state.bins().size()));
        if (bin.total < MIN_BIN_TOTAL) {
            return safe;
        }
        return clamp01((double) bin.correct / bin.total);
    }

    public synchronized int getSupport(RouteName route) {
        RouteState state = byRoute.get(route);
        return state == null ? 0 : state.support;
    }

    /**
     * Replaces the histograms with the persisted ones. Unknown routes are skipped.
     *
     * @throws RouterConfigException if the file cannot be read or parsed
     */
    public synchronized void loadFromFile(Path file) {
        PersistedState persisted;
        try {
            persisted = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), PersistedState.class);
        } catch (IOException e) {
            throw new RouterConfigException("Invalid calibration file " + file + ": " + e.getMessage(), e);
        }
        if (persisted == null || persisted.byRoute() == null) {
            throw new RouterConfigException("Invalid calibration file " + file);
        }
        byRoute.clear();
        persisted.byRoute().forEach((routeId, state) -> {
            Optional<RouteName> name = RouteName.fromId(routeId);
            if (name.isEmpty() || state == null || state.bins() == null) {
                return;
            }
            List<Bin> loaded = new ArrayList<>();
            for (PersistedBin bin : state.bins()) {
                double min = clamp01(bin.min());
                double max = clamp01(bin.max());
                if (max >= min) {
                    loaded.add(new Bin(min, max, Math.max(0, bin.total()), Math.max(0, bin.correct())));
                }
            }
            byRoute.put(name.get(), new RouteState(loaded, Math.max(0, state.support())));
        });
        log.info("confidence.loaded file={} routes={}", file, byRoute.size());
    }

    public synchronized void saveToFile(Path file) {
        Map<String, PersistedRoute> routes = new LinkedHashMap<>();
        byRoute.forEach((name, state) -> routes.put(name.getId(), new PersistedRoute(
                state.bins().stream().map(b -> new PersistedBin(b.min, b.max, b.total, b.correct)).toList(),
                state.support)));
        PersistedState persisted = new PersistedState(1, Instant.now(clock).toString(), bins, routes);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, objectMapper.writeValueAsString(persisted) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RouterConfigException("Failed to write calibration file " + file + ": " + e.getMessage(), e);
        }
    }

    private static int bucket(double score, int binCount) {
        return Math.min(binCount - 1, (int) Math.floor(score * binCount));
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Bin {
        final double min;
        final double max;
        int total;
        int correct;

        Bin(double min, double max, int total, int correct) {
            this.min = min;
            this.max = max;
            this.total = total;
            this.correct = correct;
        }
    }

    private static final class RouteState {
        private final List<Bin> bins;
        int support;

        RouteState(List<Bin> bins, int support) {
            this.bins = bins;
            this.support = support;
        }

        static RouteState empty(int count) {
            List<Bin> bins = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                bins.add(new Bin((double) i / count, (double) (i + 1) / count, 0, 0));
            }
            return new RouteState(bins, 0);
        }

        List<Bin> bins() {
            return bins;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PersistedBin(double min, double max, int total, int correct) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PersistedRoute(List<PersistedBin> bins, int support) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PersistedState(int version, String updatedAt, int bins, Map<String, PersistedRoute> byRoute) {}
}
