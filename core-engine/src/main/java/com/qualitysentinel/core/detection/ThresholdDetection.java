package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.analysis.Statistics;
import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Static bound check on the latest sample.
 *
 * <p>
 * Fires when the newest value is strictly below {@code lower} or strictly
 * above {@code upper}. Bounds come from the sample itself (captured at
 * arrival) and fall back to the metric's registration. The change is measured
 * against the baseline snapshot taken when the sample was recorded.
 * </p>
 *
 * <p>
 * Runs on sample arrival; it needs no window.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetection implements DetectionMethod {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetection.class);

    @Override
    public Optional<Detection> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Optional<MetricSample> latest = context.latest();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        MetricSample sample = latest.get();
        Thresholds bounds = sample.getThresholds().isEmpty()
                ? context.getMetric().getThresholds()
                : sample.getThresholds();
        if (bounds.isEmpty()) {
            LOG.trace("{}: no thresholds configured, skipping", sample.getKey());
            return Optional.empty();
        }

        double value = sample.getValue();
        String violation = null;
        if (bounds.getLower() != null && value < bounds.getLower()) {
            violation = String.format("Lower threshold violation: %s < %s", value, bounds.getLower());
        } else if (bounds.getUpper() != null && value > bounds.getUpper()) {
            violation = String.format("Upper threshold violation: %s > %s", value, bounds.getUpper());
        }
        if (violation == null) {
            return Optional.empty();
        }

        double baseline = sample.getBaselineSnapshot().orElse(0.0);
        double change = Statistics.changePercent(value, baseline);
        double score = Math.min(1.0, Math.abs(change) / 100.0);
        LOG.debug("{} fired: {}", sample.getKey(), violation);
        return Optional.of(new Detection(DetectionMethodType.THRESHOLD, baseline, value, change, score, violation));
    }

    @Override
    public DetectionMethodType type() {
        return DetectionMethodType.THRESHOLD;
    }

    @Override
    public boolean onArrival() {
        return true;
    }
}
