package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.analysis.RootCauseAnalyzer;
import com.qualitysentinel.core.analysis.SeverityClassifier;
import com.qualitysentinel.core.events.EventStore;
import com.qualitysentinel.core.model.MonitoredMetric;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns a {@link Detection} candidate into a complete
 * {@link RegressionEvent}: severity, root cause, recommended actions, id and
 * timestamps.
 *
 * <p>
 * {@code firstOccurrence} carries over from the previous event of the same
 * metric and method when that event was detected within the recurrence
 * window; otherwise it equals {@code detectedAt}.
 * </p>
 *
 * @since 1.0.0
 */
public class RegressionEventFactory {

    private final SeverityClassifier classifier;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final EventStore eventStore;
    private final Duration recurrenceWindow;
    private final Clock clock;

    public RegressionEventFactory(SeverityClassifier classifier,
            RootCauseAnalyzer rootCauseAnalyzer,
            EventStore eventStore,
            Duration recurrenceWindow,
            Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.rootCauseAnalyzer = Objects.requireNonNull(rootCauseAnalyzer, "rootCauseAnalyzer must not be null");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore must not be null");
        this.recurrenceWindow = Objects.requireNonNull(recurrenceWindow, "recurrenceWindow must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RegressionEvent create(MonitoredMetric metric, Detection detection) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(detection, "detection must not be null");

        Instant now = clock.instant();
        Severity severity = classifier.classify(detection.getChangePercentage());
        Instant firstOccurrence = eventStore
                .lastEvent(metric.getComponentId(), metric.getMetricName(), detection.getMethod())
                .filter(previous -> !previous.getDetectedAt().isBefore(now.minus(recurrenceWindow)))
                .map(RegressionEvent::getFirstOccurrence)
                .orElse(now);

        return RegressionEvent.builder()
                .id(UUID.randomUUID().toString())
                .category(metric.getCategory())
                .key(metric.getKey())
                .detectionMethod(detection.getMethod())
                .severity(severity)
                .regressionScore(detection.getScore())
                .baselineValue(detection.getBaselineValue())
                .currentValue(detection.getCurrentValue())
                .changePercentage(detection.getChangePercentage())
                .detectedAt(now)
                .firstOccurrence(firstOccurrence)
                .description(detection.getDescription())
                .rootCause(rootCauseAnalyzer.analyze(
                        metric.getCategory(), detection.getCurrentValue(), detection.getBaselineValue()))
                .recommendedActions(rootCauseAnalyzer.recommend(metric.getCategory(), severity))
                .build();
    }
}
