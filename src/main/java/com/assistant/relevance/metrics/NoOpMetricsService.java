package com.assistant.relevance.metrics;

import com.assistant.relevance.router.RouteName;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRouteDuration(Duration duration) {
    }

    @Override
    public void incrementRouteAccepted(RouteName handler) {
    }

    @Override
    public void incrementRouteRejected() {
    }

    @Override
    public void recordRouteScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordRecallDuration(String backend, Duration duration) {
    }

    @Override
    public void recordRecallResults(int count) {
    }

    @Override
    public void incrementRecallFallback(String failedBackend) {
    }

    @Override
    public void recordCalibration(double beforeAccuracy, double afterAccuracy) {
    }
}
