package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.MutableClock;
import com.qualitysentinel.core.analysis.RootCauseAnalyzer;
import com.qualitysentinel.core.analysis.SeverityClassifier;
import com.qualitysentinel.core.config.ImmediateCheckSettings;
import com.qualitysentinel.core.config.MethodsConfig;
import com.qualitysentinel.core.config.SeveritySettings;
import com.qualitysentinel.core.events.EventStore;
import com.qualitysentinel.core.metrics.SentinelMetrics;
import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.MonitoredMetric;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.Thresholds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.qualitysentinel.core.detection.DetectionFixtures.KEY;
import static com.qualitysentinel.core.detection.DetectionFixtures.baseline;
import static com.qualitysentinel.core.detection.DetectionFixtures.concat;
import static com.qualitysentinel.core.detection.DetectionFixtures.metric;
import static com.qualitysentinel.core.detection.DetectionFixtures.repeat;
import static com.qualitysentinel.core.detection.DetectionFixtures.window;
import static org.assertj.core.api.Assertions.assertThat;

class DetectionEngineTest {

    private MutableClock clock;
    private SentinelMetrics metrics;
    private SeverityClassifier classifier;
    private RegressionEventFactory eventFactory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        metrics = new SentinelMetrics();
        classifier = new SeverityClassifier(new SeveritySettings());
        eventFactory = new RegressionEventFactory(classifier, new RootCauseAnalyzer(), new EventStore(),
                Duration.ofMinutes(30), clock);
    }

    @Test
    @DisplayName("A failing method should not stop the remaining methods")
    void shouldIsolateMethodFailures() {
        List<DetectionMethod> methods = new ArrayList<>();
        methods.add(failing(DetectionMethodType.STATISTICAL));
        methods.add(new ChangePointDetection(new MethodsConfig.ChangePoint()));
        DetectionEngine engine = engine(methods);

        List<RegressionEvent> events = engine.evaluate(metric(), window(concat(repeat(100, 5), repeat(140, 5))), null);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getDetectionMethod()).isEqualTo(DetectionMethodType.CHANGE_POINT);
        assertThat(metrics.getRegistry().get("quality_sentinel_method_failures_total")
                .tag("method", "statistical").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failure while building one event should not stop the remaining methods")
    void shouldIsolateEnrichmentFailures() {
        RegressionEventFactory brokenForStatistical = new RegressionEventFactory(classifier,
                new RootCauseAnalyzer(), new EventStore(), Duration.ofMinutes(30), clock) {
            @Override
            public RegressionEvent create(MonitoredMetric metric, Detection detection) {
                if (detection.getMethod() == DetectionMethodType.STATISTICAL) {
                    throw new IllegalStateException("enrichment failed");
                }
                return super.create(metric, detection);
            }
        };
        List<DetectionMethod> methods = new ArrayList<>();
        methods.add(firing(DetectionMethodType.STATISTICAL));
        methods.add(new ChangePointDetection(new MethodsConfig.ChangePoint()));
        DetectionEngine engine = new DetectionEngine(methods, brokenForStatistical, classifier,
                new ImmediateCheckSettings(), metrics);

        List<RegressionEvent> events = engine.evaluate(metric(), window(concat(repeat(100, 5), repeat(140, 5))), null);

        assertThat(events).extracting(RegressionEvent::getDetectionMethod)
                .containsExactly(DetectionMethodType.CHANGE_POINT);
        assertThat(metrics.getRegistry().get("quality_sentinel_method_failures_total")
                .tag("method", "statistical").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Every firing method should emit its own event")
    void shouldEmitAllFiringMethods() {
        DetectionEngine engine = engine(DetectionMethodFactory.createEnabled(new MethodsConfig()));
        double[] series = concat(repeat(100, 27), repeat(200, 3));

        List<RegressionEvent> events = engine.evaluate(metric(), window(series), baseline(100));

        assertThat(events).extracting(RegressionEvent::getDetectionMethod)
                .contains(DetectionMethodType.ANOMALY, DetectionMethodType.TREND)
                .doesNotContain(DetectionMethodType.THRESHOLD);
        assertThat(events).allSatisfy(e -> {
            assertThat(e.getComponentId()).isEqualTo(KEY.getComponentId());
            assertThat(e.getDetectedAt()).isEqualTo(clock.instant());
            assertThat(e.getRecommendedActions()).isNotEmpty();
        });
    }

    @Test
    @DisplayName("Threshold should run on arrival only, not in the periodic cycle")
    void shouldSplitArrivalAndPeriodicMethods() {
        DetectionEngine engine = engine(DetectionMethodFactory.createEnabled(new MethodsConfig()));

        assertThat(engine.arrivalMethods()).containsExactly(DetectionMethodType.THRESHOLD);
        assertThat(engine.periodicMethods()).doesNotContain(DetectionMethodType.THRESHOLD).hasSize(4);
    }

    @Test
    @DisplayName("Arrival threshold violation should produce an event immediately")
    void shouldDetectThresholdOnArrival() {
        DetectionEngine engine = engine(DetectionMethodFactory.createEnabled(new MethodsConfig()));
        Thresholds bounds = Thresholds.of(10.0, 90.0);

        List<RegressionEvent> events = engine.evaluateArrival(metric(bounds), sample(95, 50.0, bounds));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getDetectionMethod()).isEqualTo(DetectionMethodType.THRESHOLD);
            assertThat(e.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(e.getDescription()).contains("Upper threshold");
        });
    }

    @Test
    @DisplayName("Immediate check should fire only for major or critical jumps against the snapshot")
    void shouldRunImmediateDeviationCheck() {
        DetectionEngine engine = engine(DetectionMethodFactory.createEnabled(new MethodsConfig()));

        List<RegressionEvent> major = engine.evaluateArrival(metric(), sample(140, 100.0, null));
        assertThat(major).singleElement().satisfies(e -> {
            assertThat(e.getDetectionMethod()).isEqualTo(DetectionMethodType.THRESHOLD);
            assertThat(e.getSeverity()).isEqualTo(Severity.MAJOR);
            assertThat(e.getDescription()).startsWith("Immediate regression detected");
        });

        // 28% exceeds the 25% trigger but is only MODERATE
        assertThat(engine.evaluateArrival(metric(), sample(128, 100.0, null))).isEmpty();
        assertThat(engine.evaluateArrival(metric(), sample(120, 100.0, null))).isEmpty();
        assertThat(engine.evaluateArrival(metric(), sample(500, null, null))).isEmpty();
    }

    @Test
    @DisplayName("Disabled immediate check should stay silent")
    void shouldHonourDisabledImmediateCheck() {
        ImmediateCheckSettings off = new ImmediateCheckSettings();
        off.setEnabled(false);
        DetectionEngine engine = new DetectionEngine(List.of(), eventFactory, classifier, off, metrics);

        assertThat(engine.evaluateArrival(metric(), sample(300, 100.0, null))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private DetectionEngine engine(List<DetectionMethod> methods) {
        return new DetectionEngine(methods, eventFactory, classifier, new ImmediateCheckSettings(), metrics);
    }

    private MetricSample sample(double value, Double snapshot, Thresholds bounds) {
        return MetricSample.builder()
                .timestamp(clock.instant())
                .key(KEY)
                .value(value)
                .baselineSnapshot(snapshot)
                .thresholds(bounds)
                .build();
    }

    private static DetectionMethod firing(DetectionMethodType type) {
        return new DetectionMethod() {
            @Override
            public Optional<Detection> evaluate(DetectionContext context) {
                return Optional.of(new Detection(type, 100.0, 140.0, 40.0, 0.9, "fixed firing"));
            }

            @Override
            public DetectionMethodType type() {
                return type;
            }
        };
    }

    private static DetectionMethod failing(DetectionMethodType type) {
        return new DetectionMethod() {
            @Override
            public Optional<Detection> evaluate(DetectionContext context) {
                throw new IllegalStateException("boom");
            }

            @Override
            public DetectionMethodType type() {
                return type;
            }
        };
    }
}
