package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.analysis.SeverityClassifier;
import com.qualitysentinel.core.analysis.Statistics;
import com.qualitysentinel.core.config.ImmediateCheckSettings;
import com.qualitysentinel.core.metrics.SentinelMetrics;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.MonitoredMetric;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the configured {@link DetectionMethod}s against one metric and turns
 * every firing into a {@link RegressionEvent}.
 *
 * <h3>Two entry points</h3>
 * <ul>
 *   <li>{@link #evaluate} runs the periodic methods over a window snapshot.</li>
 *   <li>{@link #evaluateArrival} runs the arrival methods on a single new
 *       sample, followed by the immediate deviation check when no arrival
 *       method fired.</li>
 * </ul>
 *
 * <h3>Fault isolation</h3>
 * <p>
 * Each method, together with the enrichment of its firing, is invoked inside
 * its own try/catch. A method that throws is logged with the metric and
 * method name, counted, and skipped; the remaining methods still run. All
 * firings are emitted; there is no suppression across methods.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final List<DetectionMethod> periodic;
    private final List<DetectionMethod> arrival;
    private final RegressionEventFactory eventFactory;
    private final SeverityClassifier classifier;
    private final ImmediateCheckSettings immediateCheck;
    private final SentinelMetrics metrics;

    public DetectionEngine(List<DetectionMethod> methods,
            RegressionEventFactory eventFactory,
            SeverityClassifier classifier,
            ImmediateCheckSettings immediateCheck,
            SentinelMetrics metrics) {
        Objects.requireNonNull(methods, "methods must not be null");
        this.eventFactory = Objects.requireNonNull(eventFactory, "eventFactory must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.immediateCheck = Objects.requireNonNull(immediateCheck, "immediateCheck must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");

        List<DetectionMethod> periodicMethods = new ArrayList<>();
        List<DetectionMethod> arrivalMethods = new ArrayList<>();
        for (DetectionMethod method : methods) {
            if (method.onArrival()) {
                arrivalMethods.add(method);
            } else {
                periodicMethods.add(method);
            }
        }
        this.periodic = List.copyOf(periodicMethods);
        this.arrival = List.copyOf(arrivalMethods);
    }

    /**
     * Run every periodic method over a window of one metric.
     *
     * @param metric   the metric under evaluation
     * @param window   immutable snapshot of its samples, oldest first
     * @param baseline current baseline, or {@code null}
     * @return one event per method that fired
     */
    public List<RegressionEvent> evaluate(MonitoredMetric metric, List<MetricSample> window, Baseline baseline) {
        return run(periodic, new DetectionContext(metric, window, baseline));
    }

    /**
     * Run the arrival methods on one freshly recorded sample.
     *
     * @param metric the metric the sample belongs to
     * @param sample the new sample
     * @return events raised by the sample, possibly empty
     */
    public List<RegressionEvent> evaluateArrival(MonitoredMetric metric, MetricSample sample) {
        DetectionContext context = new DetectionContext(metric, List.of(sample), null);
        List<RegressionEvent> events = run(arrival, context);
        if (events.isEmpty() && immediateCheck.isEnabled()) {
            immediateDeviation(sample).ifPresent(d -> events.add(eventFactory.create(metric, d)));
        }
        return events;
    }

    public List<DetectionMethodType> periodicMethods() {
        return periodic.stream().map(DetectionMethod::type).toList();
    }

    public List<DetectionMethodType> arrivalMethods() {
        return arrival.stream().map(DetectionMethod::type).toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<RegressionEvent> run(List<DetectionMethod> methods, DetectionContext context) {
        List<RegressionEvent> events = new ArrayList<>();
        for (DetectionMethod method : methods) {
            try {
                Optional<Detection> detection = method.evaluate(context);
                if (detection.isPresent()) {
                    events.add(eventFactory.create(context.getMetric(), detection.get()));
                }
            } catch (RuntimeException e) {
                metrics.incrementMethodFailures(method.type());
                LOG.error("Detection method {} failed for {}: {}",
                        method.type().label(), context.getMetric().getKey(), e.getMessage(), e);
            }
        }
        return events;
    }

    /**
     * Large jump of a single sample against the baseline it was recorded
     * with. Reported as a threshold regression, and only at MAJOR or above.
     */
    private Optional<Detection> immediateDeviation(MetricSample sample) {
        Optional<Double> snapshot = sample.getBaselineSnapshot();
        if (snapshot.isEmpty() || snapshot.get() == 0.0) {
            return Optional.empty();
        }
        double baseline = snapshot.get();
        double change = Statistics.changePercent(sample.getValue(), baseline);
        if (!Double.isFinite(change) || Math.abs(change) <= immediateCheck.getChangePercent()) {
            return Optional.empty();
        }
        if (!classifier.classify(change).isAtLeast(Severity.MAJOR)) {
            return Optional.empty();
        }
        return Optional.of(new Detection(
                DetectionMethodType.THRESHOLD,
                baseline,
                sample.getValue(),
                change,
                Math.min(1.0, Math.abs(change) / 100.0),
                String.format("Immediate regression detected: %.1f%% change", change)));
    }
}
