package com.assistant.relevance.metrics;

import com.assistant.relevance.router.RouteName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordRouteDuration(Duration.ofMillis(3));
                noOp.incrementRouteAccepted(RouteName.GMAIL);
                noOp.incrementRouteRejected();
                noOp.recordRouteScore(0.42);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordRecallDuration("hybrid", Duration.ofMillis(12));
                noOp.recordRecallResults(4);
                noOp.incrementRecallFallback("hybrid");
                noOp.recordCalibration(0.6, 0.7);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record route duration as timer")
        void recordsRouteDuration() {
            metrics.recordRouteDuration(Duration.ofMillis(5));
            metrics.recordRouteDuration(Duration.ofMillis(15));

            Timer timer = registry.find("relevance.route.duration").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.01);
        }

        @Test
        @DisplayName("Should count accepted decisions per handler")
        void countsAcceptedPerHandler() {
            metrics.incrementRouteAccepted(RouteName.GMAIL);
            metrics.incrementRouteAccepted(RouteName.GMAIL);
            metrics.incrementRouteAccepted(RouteName.WEB);

            Counter gmail = registry.find("relevance.route.accepted").tag("handler", "gmail").counter();
            Counter web = registry.find("relevance.route.accepted").tag("handler", "web").counter();
            assertEquals(2.0, gmail.count());
            assertEquals(1.0, web.count());
        }

        @Test
        @DisplayName("Should count rejections and record accepted scores")
        void countsRejectionsAndScores() {
            metrics.incrementRouteRejected();
            metrics.recordRouteScore(0.4);
            metrics.recordRouteScore(0.6);

            assertEquals(1.0, registry.find("relevance.route.rejected").counter().count());
            DistributionSummary scores = registry.find("relevance.route.score").summary();
            assertEquals(2, scores.count());
            assertEquals(0.5, scores.mean(), 1e-9);
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void countsCache() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("relevance.cache.hit").counter().count());
            assertEquals(2.0, registry.find("relevance.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should tag recall durations and fallbacks by backend")
        void tagsRecallByBackend() {
            metrics.recordRecallDuration("hybrid", Duration.ofMillis(10));
            metrics.recordRecallDuration("scan", Duration.ofMillis(4));
            metrics.incrementRecallFallback("hybrid");
            metrics.recordRecallResults(3);

            assertEquals(1, registry.find("relevance.recall.duration").tag("backend", "hybrid").timer().count());
            assertEquals(1, registry.find("relevance.recall.duration").tag("backend", "scan").timer().count());
            assertEquals(1.0, registry.find("relevance.recall.fallback").tag("backend", "hybrid").counter().count());
            assertEquals(3.0, registry.find("relevance.recall.results").summary().totalAmount());
        }

        @Test
        @DisplayName("Should record calibration accuracy by phase")
        void recordsCalibration() {
            metrics.recordCalibration(0.6, 0.8);

            assertEquals(0.6, registry.find("relevance.calibration.accuracy").tag("phase", "before")
                    .summary().totalAmount(), 1e-9);
            assertEquals(0.8, registry.find("relevance.calibration.accuracy").tag("phase", "after")
                    .summary().totalAmount(), 1e-9);
        }
    }
}
