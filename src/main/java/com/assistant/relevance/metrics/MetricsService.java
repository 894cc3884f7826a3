package com.assistant.relevance.metrics;

import com.assistant.relevance.router.RouteName;

import java.time.Duration;

/**
 * Interface for recording relevance engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRouteDuration(Duration duration);

    void incrementRouteAccepted(RouteName handler);

    void incrementRouteRejected();

    void recordRouteScore(double score);

    void recordCacheHit();

    void recordCacheMiss();

    void recordRecallDuration(String backend, Duration duration);

    void recordRecallResults(int count);

    void incrementRecallFallback(String failedBackend);

    void recordCalibration(double beforeAccuracy, double afterAccuracy);
}
