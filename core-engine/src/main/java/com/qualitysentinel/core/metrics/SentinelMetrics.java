package com.qualitysentinel.core.metrics;

import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Engine metric definitions.
 * <p>
 * Meters are registered on the supplied {@link MeterRegistry}; exporting them
 * (Prometheus, JMX, ...) is the embedding process's choice. Without a
 * registry the engine records into a {@link SimpleMeterRegistry}.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code quality_sentinel_samples_recorded_total}: accepted samples</li>
 *   <li>{@code quality_sentinel_samples_dropped_total}: rejected samples</li>
 *   <li>{@code quality_sentinel_regressions_detected_total}: stored events,
 *       tagged by {@code method} and {@code severity}</li>
 *   <li>{@code quality_sentinel_method_failures_total}: method faults,
 *       tagged by {@code method}</li>
 *   <li>{@code quality_sentinel_detection_cycle_duration}: cycle latency</li>
 * </ul>
 */
public class SentinelMetrics {

    static final String SAMPLES_RECORDED = "quality_sentinel_samples_recorded_total";
    static final String SAMPLES_DROPPED = "quality_sentinel_samples_dropped_total";
    static final String REGRESSIONS_DETECTED = "quality_sentinel_regressions_detected_total";
    static final String METHOD_FAILURES = "quality_sentinel_method_failures_total";
    static final String CYCLE_DURATION = "quality_sentinel_detection_cycle_duration";

    private final MeterRegistry registry;
    private final Counter samplesRecorded;
    private final Counter samplesDropped;
    private final Timer cycleDuration;

    public SentinelMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.samplesRecorded = registry.counter(SAMPLES_RECORDED);
        this.samplesDropped = registry.counter(SAMPLES_DROPPED);
        this.cycleDuration = registry.timer(CYCLE_DURATION);
    }

    public void incrementSamplesRecorded() {
        samplesRecorded.increment();
    }

    public void incrementSamplesDropped() {
        samplesDropped.increment();
    }

    public void incrementRegressionsDetected(DetectionMethodType method, Severity severity) {
        registry.counter(REGRESSIONS_DETECTED, "method", method.label(), "severity", severity.label()).increment();
    }

    public void incrementMethodFailures(DetectionMethodType method) {
        registry.counter(METHOD_FAILURES, "method", method.label()).increment();
    }

    public void recordCycleDuration(long nanos) {
        cycleDuration.record(nanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
