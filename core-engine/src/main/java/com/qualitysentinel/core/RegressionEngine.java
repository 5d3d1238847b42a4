package com.qualitysentinel.core;

import com.qualitysentinel.core.alerting.AlertDispatcher;
import com.qualitysentinel.core.alerting.RegressionListener;
import com.qualitysentinel.core.analysis.RootCauseAnalyzer;
import com.qualitysentinel.core.analysis.SeverityClassifier;
import com.qualitysentinel.core.baseline.BaselineManager;
import com.qualitysentinel.core.buffer.SampleBuffer;
import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.detection.DetectionEngine;
import com.qualitysentinel.core.detection.DetectionMethod;
import com.qualitysentinel.core.detection.DetectionMethodFactory;
import com.qualitysentinel.core.detection.RegressionEventFactory;
import com.qualitysentinel.core.events.EventStore;
import com.qualitysentinel.core.events.ReportAggregator;
import com.qualitysentinel.core.metrics.SentinelMetrics;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.EngineStatus;
import com.qualitysentinel.core.model.MetricKey;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.MonitoredMetric;
import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.RegressionReport;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.Thresholds;
import com.qualitysentinel.core.registry.MetricRegistry;
import com.qualitysentinel.core.scheduler.DetectionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the quality regression detection engine.
 *
 * <p>
 * One instance owns the whole pipeline: metric registry, sample buffer,
 * baselines, detection methods, event and report stores, alerting and the
 * periodic scheduler. The composition root constructs it and hands it to
 * producers (which call {@link #recordSample}) and to report consumers.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every public method may be called from any thread. Sample recording is
 * expected from many producer threads at once; detection runs on the single
 * scheduler worker, or on the caller's thread via {@link #runDetectionCycle()}.
 * </p>
 *
 * <h3>Error handling</h3>
 * <p>
 * Invalid configuration or registration arguments throw. Everything at the
 * runtime boundary (unknown metrics, non-finite values, detection faults) is
 * logged and absorbed: callers get a result or an explicit {@code false} /
 * empty signal, never an exception from the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class RegressionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RegressionEngine.class);

    private final DetectionConfig config;
    private final Clock clock;
    private final SentinelMetrics metrics;
    private final MetricRegistry registry;
    private final SampleBuffer buffer;
    private final BaselineManager baselines;
    private final EventStore eventStore;
    private final ReportAggregator reports;
    private final DetectionEngine detectionEngine;
    private final AlertDispatcher alerts;
    private final DetectionScheduler scheduler;

    public RegressionEngine(DetectionConfig config) {
        this(config, Clock.systemUTC(), new SentinelMetrics());
    }

    /**
     * @param config  validated detection configuration
     * @param clock   time source for every timestamp and window
     * @param metrics meter holder
     * @throws IllegalStateException if the configuration is invalid
     */
    public RegressionEngine(DetectionConfig config, Clock clock, SentinelMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null").validate();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");

        this.registry = new MetricRegistry(clock);
        this.buffer = new SampleBuffer(config.getMaxSamplesPerComponent(), clock);
        this.baselines = new BaselineManager(registry, buffer, config.getBaseline(), clock);
        this.eventStore = new EventStore();
        this.reports = new ReportAggregator(eventStore, clock);

        SeverityClassifier classifier = new SeverityClassifier(config.getSeverity());
        RegressionEventFactory eventFactory = new RegressionEventFactory(
                classifier, new RootCauseAnalyzer(), eventStore, config.recurrenceWindow(), clock);
        List<DetectionMethod> methods = DetectionMethodFactory.createEnabled(config.getMethods());
        this.detectionEngine = new DetectionEngine(
                methods, eventFactory, classifier, config.getImmediateCheck(), metrics);

        this.alerts = new AlertDispatcher(config.getAlerting(), clock);
        this.scheduler = new DetectionScheduler(
                this::runDetectionCycle, config.detectionInterval(), config.errorBackoff());
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    public MetricKey registerMetric(String componentId, String metricName, RegressionCategory category) {
        return registerMetric(componentId, metricName, category, null, null);
    }

    public MetricKey registerMetric(String componentId, String metricName, RegressionCategory category,
            Double baseline) {
        return registerMetric(componentId, metricName, category, baseline, null);
    }

    /**
     * Register or update a monitored metric. A manual baseline, when given,
     * is stored immediately and never expires.
     *
     * @param componentId owning component; must not be blank
     * @param metricName  metric name; must not be blank
     * @param category    regression category; must not be {@code null}
     * @param baseline    manual baseline, or {@code null}
     * @param thresholds  static bounds, or {@code null}
     * @return the canonical key
     * @throws IllegalArgumentException if an argument is invalid
     */
    public MetricKey registerMetric(String componentId, String metricName, RegressionCategory category,
            Double baseline, Thresholds thresholds) {
        MetricKey key = registry.register(componentId, metricName, category, baseline, thresholds);
        if (baseline != null) {
            baselines.createManual(key, baseline);
        }
        return key;
    }

    public boolean recordSample(String componentId, String metricName, double value) {
        return recordSample(componentId, metricName, value, null);
    }

    /**
     * Record one sample and run the arrival checks on it.
     *
     * <p>
     * Samples for unregistered metrics and non-finite values are dropped with
     * a warning; they are never queued.
     * </p>
     *
     * @param componentId owning component
     * @param metricName  metric name
     * @param value       observed value
     * @param metadata    opaque attributes, or {@code null}
     * @return {@code true} if the sample was accepted
     */
    public boolean recordSample(String componentId, String metricName, double value, Map<String, Object> metadata) {
        Optional<MonitoredMetric> registered = registry.lookup(componentId, metricName);
        if (registered.isEmpty()) {
            LOG.warn("Dropping sample for unregistered metric {}.{}", componentId, metricName);
            metrics.incrementSamplesDropped();
            return false;
        }
        MonitoredMetric metric = registered.get();
        if (!Double.isFinite(value)) {
            LOG.warn("Dropping non-finite sample for {}: {}", metric.getKey(), value);
            metrics.incrementSamplesDropped();
            return false;
        }

        MetricSample sample = MetricSample.builder()
                .timestamp(clock.instant())
                .key(metric.getKey())
                .value(value)
                .baselineSnapshot(baselines.current(metric.getKey()).map(Baseline::getValue).orElse(null))
                .thresholds(metric.getThresholds())
                .metadata(metadata)
                .build();
        buffer.append(sample);
        metrics.incrementSamplesRecorded();

        try {
            for (RegressionEvent event : detectionEngine.evaluateArrival(metric, sample)) {
                publish(event);
            }
        } catch (RuntimeException e) {
            LOG.error("Arrival check failed for {}: {}", metric.getKey(), e.getMessage(), e);
        }
        return true;
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Run one detection cycle on the calling thread: periodic detection for
     * every metric with enough recent samples, then the cadence-gated baseline
     * refresh, then retention pruning.
     *
     * @return events raised by this cycle
     */
    public List<RegressionEvent> runDetectionCycle() {
        long startNanos = System.nanoTime();
        List<RegressionEvent> detected = new ArrayList<>();
        List<MonitoredMetric> monitored = registry.all();

        for (MonitoredMetric metric : monitored) {
            try {
                List<MetricSample> window = buffer.snapshot(
                        metric.getComponentId(), metric.getMetricName(), config.detectionWindow());
                if (window.size() < config.getMinSamplesPerMetric()) {
                    continue;
                }
                Baseline baseline = baselines.current(metric.getKey()).orElse(null);
                for (RegressionEvent event : detectionEngine.evaluate(metric, window, baseline)) {
                    publish(event);
                    detected.add(event);
                }
            } catch (RuntimeException e) {
                LOG.error("Detection failed for {}: {}", metric.getKey(), e.getMessage(), e);
            }
        }

        if (config.getBaseline().isAutoUpdate()) {
            for (MonitoredMetric metric : monitored) {
                try {
                    baselines.maybeRefresh(metric.getKey());
                } catch (RuntimeException e) {
                    LOG.error("Baseline refresh failed for {}: {}", metric.getKey(), e.getMessage(), e);
                }
            }
        }

        pruneExpired();
        metrics.recordCycleDuration(System.nanoTime() - startNanos);
        LOG.debug("Detection cycle complete: {} metrics, {} regressions", monitored.size(), detected.size());
        return detected;
    }

    private void publish(RegressionEvent event) {
        eventStore.record(event);
        metrics.incrementRegressionsDetected(event.getDetectionMethod(), event.getSeverity());
        alerts.dispatch(event);
    }

    private void pruneExpired() {
        Instant cutoff = clock.instant().minus(config.retention());
        int events = eventStore.prune(cutoff);
        int oldReports = reports.prune(cutoff);
        int oldBaselines = baselines.prune(cutoff);
        if (events + oldReports + oldBaselines > 0) {
            LOG.info("Retention pruned {} events, {} reports, {} baselines older than {}",
                    events, oldReports, oldBaselines, cutoff);
        }
    }

    // ---------------------------------------------------------------
    // Queries and reports
    // ---------------------------------------------------------------

    /**
     * @param componentId only this component, or {@code null}
     * @param severity    only this severity, or {@code null}
     * @param since       only events detected at or after this instant, or
     *                    {@code null}
     * @return matching events, newest first
     */
    public List<RegressionEvent> listEvents(String componentId, Severity severity, Instant since) {
        return eventStore.query(componentId, severity, since);
    }

    /**
     * Generate and store a report over {@code [start, end]}.
     *
     * @param start period start; must not be {@code null}
     * @param end   period end; must not be {@code null}
     * @return id of the stored report, or empty if {@code start} is after
     *         {@code end}
     */
    public Optional<String> generateReport(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (start.isAfter(end)) {
            LOG.warn("Report not generated: period start {} is after end {}", start, end);
            return Optional.empty();
        }
        return Optional.of(reports.generate(start, end).getId());
    }

    /** Report over the default period ending now. */
    public String generateReport() {
        Instant end = clock.instant();
        return reports.generate(end.minus(config.defaultReportPeriod()), end).getId();
    }

    public Optional<RegressionReport> getReport(String reportId) {
        return reports.get(reportId);
    }

    public Optional<Baseline> currentBaseline(String componentId, String metricName) {
        return registry.lookup(componentId, metricName).flatMap(m -> baselines.current(m.getKey()));
    }

    public EngineStatus status() {
        return new EngineStatus(
                registry.size(),
                baselines.count(),
                buffer.totalSamples(),
                eventStore.size(),
                reports.size(),
                scheduler.isRunning(),
                config.detectionInterval(),
                config.getMethods().enabledMethods());
    }

    // ---------------------------------------------------------------
    // Lifecycle and listeners
    // ---------------------------------------------------------------

    public void start() {
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    public void addListener(RegressionListener listener) {
        alerts.addListener(listener);
    }

    public void removeListener(RegressionListener listener) {
        alerts.removeListener(listener);
    }

    public DetectionConfig getConfig() {
        return config;
    }

    public SentinelMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        stop();
    }
}
