package com.assistant.relevance.metrics;

import com.assistant.relevance.router.RouteName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code relevance.route.duration} - Timer</li>
 *   <li>{@code relevance.route.accepted} - Counter (tag: handler)</li>
 *   <li>{@code relevance.route.rejected} - Counter</li>
 *   <li>{@code relevance.route.score} - DistributionSummary</li>
 *   <li>{@code relevance.cache.hit} / {@code relevance.cache.miss} - Counter</li>
 *   <li>{@code relevance.recall.duration} - Timer (tag: backend)</li>
 *   <li>{@code relevance.recall.results} - DistributionSummary</li>
 *   <li>{@code relevance.recall.fallback} - Counter (tag: backend)</li>
 *   <li>{@code relevance.calibration.accuracy} - DistributionSummary (tag: phase)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer routeTimer;
    private final Counter routeRejectedCounter;
    private final DistributionSummary routeScoreSummary;
    private final DistributionSummary recallResultsSummary;
    private final DistributionSummary calibrationBeforeSummary;
    private final DistributionSummary calibrationAfterSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.routeTimer = Timer.builder("relevance.route.duration")
                .description("Duration of route classification calls")
                .register(registry);
        this.routeRejectedCounter = Counter.builder("relevance.route.rejected")
                .description("Number of route calls without a qualifying route")
                .register(registry);
        this.routeScoreSummary = DistributionSummary.builder("relevance.route.score")
                .description("Distribution of accepted route scores")
                .register(registry);
        this.recallResultsSummary = DistributionSummary.builder("relevance.recall.results")
                .description("Number of memory hits returned per recall")
                .register(registry);
        this.calibrationBeforeSummary = DistributionSummary.builder("relevance.calibration.accuracy")
                .description("Dataset accuracy around threshold calibration")
                .tag("phase", "before")
                .register(registry);
        this.calibrationAfterSummary = DistributionSummary.builder("relevance.calibration.accuracy")
                .description("Dataset accuracy around threshold calibration")
                .tag("phase", "after")
                .register(registry);
        this.cacheHitCounter = Counter.builder("relevance.cache.hit")
                .description("Number of decision cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("relevance.cache.miss")
                .description("Number of decision cache misses")
                .register(registry);
    }

    @Override
    public void recordRouteDuration(Duration duration) {
        routeTimer.record(duration);
    }

    @Override
    public void incrementRouteAccepted(RouteName handler) {
        String key = "accepted:" + handler.getId();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("relevance.route.accepted")
                        .description("Number of accepted route decisions")
                        .tag("handler", handler.getId())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRouteRejected() {
        routeRejectedCounter.increment();
    }

    @Override
    public void recordRouteScore(double score) {
        routeScoreSummary.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordRecallDuration(String backend, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(backend, k ->
                Timer.builder("relevance.recall.duration")
                        .description("Duration of memory recall searches")
                        .tag("backend", backend)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRecallResults(int count) {
        recallResultsSummary.record(count);
    }

    @Override
    public void incrementRecallFallback(String failedBackend) {
        String key = "fallback:" + failedBackend;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("relevance.recall.fallback")
                        .description("Number of recall backend fallbacks")
                        .tag("backend", failedBackend)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCalibration(double beforeAccuracy, double afterAccuracy) {
        calibrationBeforeSummary.record(beforeAccuracy);
        calibrationAfterSummary.record(afterAccuracy);
    }
}
