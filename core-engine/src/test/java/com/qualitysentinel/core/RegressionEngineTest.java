package com.qualitysentinel.core;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.metrics.SentinelMetrics;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.BaselineMethod;
import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.EngineStatus;
import com.qualitysentinel.core.model.MetricKey;
import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.RegressionReport;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.Thresholds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RegressionEngineTest {

    private MutableClock clock;
    private SentinelMetrics metrics;
    private RegressionEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        metrics = new SentinelMetrics();
        engine = new RegressionEngine(DetectionConfig.defaults(), clock, metrics);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Nested
    @DisplayName("Ingestion")
    class Ingestion {

        @Test
        @DisplayName("Unregistered metric should be rejected without buffering")
        void shouldDropUnregisteredMetric() {
            assertThat(engine.recordSample("checkout", "latency_ms", 120)).isFalse();

            assertThat(engine.status().getTotalSamples()).isZero();
            assertThat(droppedSamples()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Non-finite value should be rejected")
        void shouldDropNonFiniteValue() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE);

            assertThat(engine.recordSample("checkout", "latency_ms", Double.NaN)).isFalse();
            assertThat(engine.recordSample("checkout", "latency_ms", Double.POSITIVE_INFINITY)).isFalse();
            assertThat(engine.recordSample("checkout", "latency_ms", 120)).isTrue();

            assertThat(engine.status().getTotalSamples()).isEqualTo(1);
            assertThat(droppedSamples()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Blank registration arguments should throw")
        void shouldRejectInvalidRegistration() {
            assertThatThrownBy(() -> engine.registerMetric(" ", "latency_ms", RegressionCategory.PERFORMANCE))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.registerMetric("checkout", "latency_ms", null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Manual baseline should be available immediately")
        void shouldStoreManualBaseline() {
            MetricKey key = engine.registerMetric("model", "accuracy", RegressionCategory.ACCURACY, 0.95);

            Optional<Baseline> baseline = engine.currentBaseline(key.getComponentId(), key.getMetricName());

            assertThat(baseline).isPresent();
            assertThat(baseline.get().getMethod()).isEqualTo(BaselineMethod.MANUAL);
            assertThat(baseline.get().getValue()).isEqualTo(0.95);
            assertThat(baseline.get().getValidUntil()).isEmpty();
        }

        @Test
        @DisplayName("Repeating a registration should not add baselines")
        void shouldKeepRegistrationIdempotent() {
            for (int i = 0; i < 5; i++) {
                engine.registerMetric("svc", "latency", RegressionCategory.PERFORMANCE, 100.0);
            }

            assertThat(engine.status().getRegisteredMetrics()).isEqualTo(1);
            assertThat(engine.status().getBaselineCount()).isEqualTo(1);

            engine.registerMetric("svc", "latency", RegressionCategory.PERFORMANCE, 120.0);

            assertThat(engine.status().getBaselineCount()).isEqualTo(2);
            assertThat(engine.currentBaseline("svc", "latency").orElseThrow().getValue()).isEqualTo(120.0);
        }
    }

    @Nested
    @DisplayName("Arrival checks")
    class ArrivalChecks {

        @Test
        @DisplayName("Threshold violation should be stored as soon as the sample arrives")
        void shouldStoreThresholdEventOnArrival() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE, null,
                    Thresholds.of(null, 200.0));

            engine.recordSample("checkout", "latency_ms", 150);
            engine.recordSample("checkout", "latency_ms", 250);

            List<RegressionEvent> events = engine.listEvents("checkout", null, null);
            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.getDetectionMethod()).isEqualTo(DetectionMethodType.THRESHOLD);
                assertThat(e.getCurrentValue()).isEqualTo(250.0);
            });
        }

        @Test
        @DisplayName("Large jump against the baseline should alert listeners")
        void shouldNotifyListenersOfImmediateRegression() {
            List<RegressionEvent> alerted = new ArrayList<>();
            engine.addListener(alerted::add);
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE, 100.0);

            engine.recordSample("checkout", "latency_ms", 105);
            engine.recordSample("checkout", "latency_ms", 160);

            assertThat(alerted).singleElement().satisfies(e -> {
                assertThat(e.getSeverity()).isEqualTo(Severity.CRITICAL);
                assertThat(e.getChangePercentage()).isCloseTo(60.0, within(1e-9));
                assertThat(e.getRecommendedActions()).first().isEqualTo("IMMEDIATE ACTION REQUIRED");
            });
        }
    }

    @Nested
    @DisplayName("Detection cycle")
    class DetectionCycle {

        @Test
        @DisplayName("Level shift should be detected as a change point")
        void shouldDetectLevelShift() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE);
            record("checkout", "latency_ms", 100, 10);
            record("checkout", "latency_ms", 140, 10);

            List<RegressionEvent> detected = engine.runDetectionCycle();

            assertThat(detected).extracting(RegressionEvent::getDetectionMethod)
                    .contains(DetectionMethodType.CHANGE_POINT);
            RegressionEvent changePoint = detected.stream()
                    .filter(e -> e.getDetectionMethod() == DetectionMethodType.CHANGE_POINT)
                    .findFirst()
                    .orElseThrow();
            assertThat(changePoint.getSeverity()).isEqualTo(Severity.MAJOR);
            assertThat(changePoint.getChangePercentage()).isCloseTo(40.0, within(1e-9));
            assertThat(engine.listEvents(null, null, null)).containsAll(detected);
        }

        @Test
        @DisplayName("Metric below the minimum sample count should be skipped")
        void shouldSkipSparseMetric() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE);
            record("checkout", "latency_ms", 100, 1);
            record("checkout", "latency_ms", 900, 1);

            assertThat(engine.runDetectionCycle()).isEmpty();
        }

        @Test
        @DisplayName("Stable window should produce an automatic baseline")
        void shouldLearnAutomaticBaseline() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE);
            for (int i = 0; i < 12; i++) {
                record("checkout", "latency_ms", i % 2 == 0 ? 99 : 101, 1);
            }

            engine.runDetectionCycle();

            Optional<Baseline> baseline = engine.currentBaseline("checkout", "latency_ms");
            assertThat(baseline).isPresent();
            assertThat(baseline.get().getMethod()).isEqualTo(BaselineMethod.AUTOMATIC);
            assertThat(baseline.get().getValue()).isCloseTo(100.0, within(1e-9));
            assertThat(baseline.get().getSampleSize()).isEqualTo(12);
        }

        @Test
        @DisplayName("Events older than the retention period should be pruned")
        void shouldPruneExpiredEvents() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE, null,
                    Thresholds.of(null, 200.0));
            engine.recordSample("checkout", "latency_ms", 250);
            assertThat(engine.status().getEventCount()).isEqualTo(1);

            clock.advance(Duration.ofHours(169));
            engine.runDetectionCycle();

            assertThat(engine.status().getEventCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Reports and status")
    class ReportsAndStatus {

        @Test
        @DisplayName("Default report should cover the events of the last day")
        void shouldGenerateDefaultReport() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE, null,
                    Thresholds.of(null, 200.0));
            engine.registerMetric("search", "error_rate", RegressionCategory.RELIABILITY, null,
                    Thresholds.of(null, 0.05));
            engine.recordSample("checkout", "latency_ms", 250);
            engine.recordSample("search", "error_rate", 0.2);
            clock.advance(Duration.ofMinutes(1));

            String reportId = engine.generateReport();
            Optional<RegressionReport> report = engine.getReport(reportId);

            assertThat(report).isPresent();
            assertThat(report.get().getTotalRegressions()).isEqualTo(2);
            assertThat(report.get().getAffectedComponents()).containsExactlyInAnyOrder("checkout", "search");
            assertThat(engine.getReport("missing")).isEmpty();
        }

        @Test
        @DisplayName("Inverted report period should yield no report")
        void shouldRejectInvertedReportPeriod() {
            Instant end = clock.instant();

            Optional<String> reportId = engine.generateReport(end, end.minus(Duration.ofHours(1)));

            assertThat(reportId).isEmpty();
            assertThat(engine.generateReport(end.minus(Duration.ofHours(1)), end)).isPresent();
        }

        @Test
        @DisplayName("Status should reflect registrations, samples and scheduler state")
        void shouldReportStatus() {
            engine.registerMetric("checkout", "latency_ms", RegressionCategory.PERFORMANCE, 100.0);
            engine.registerMetric("search", "error_rate", RegressionCategory.RELIABILITY);
            engine.recordSample("checkout", "latency_ms", 101);
            engine.recordSample("search", "error_rate", 0.01);

            EngineStatus status = engine.status();

            assertThat(status.getRegisteredMetrics()).isEqualTo(2);
            assertThat(status.getBaselineCount()).isEqualTo(1);
            assertThat(status.getTotalSamples()).isEqualTo(2);
            assertThat(status.isDetectionActive()).isFalse();
            assertThat(status.getDetectionInterval()).isEqualTo(Duration.ofMinutes(5));
            assertThat(status.getEnabledMethods()).hasSize(5);
        }

        @Test
        @DisplayName("Start and close should drive the scheduler")
        void shouldStartAndStop() {
            engine.start();
            assertThat(engine.isRunning()).isTrue();
            assertThat(engine.status().isDetectionActive()).isTrue();

            engine.close();
            assertThat(engine.isRunning()).isFalse();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void record(String component, String metric, double value, int times) {
        for (int i = 0; i < times; i++) {
            clock.advance(Duration.ofSeconds(10));
            engine.recordSample(component, metric, value);
        }
    }

    private double droppedSamples() {
        return metrics.getRegistry().get("quality_sentinel_samples_dropped_total").counter().count();
    }
}
