package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.analysis.Statistics;
import com.qualitysentinel.core.config.MethodsConfig;
import com.qualitysentinel.core.model.DetectionMethodType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Least-squares slope of value against sample index.
 *
 * <p>
 * Fires when {@code |slope|} exceeds the slope threshold. Requires a
 * baseline; the reported change is the latest value against it.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetection implements DetectionMethod {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetection.class);

    private final int minSamples;
    private final double slopeThreshold;

    public TrendDetection(MethodsConfig.Trend config) {
        Objects.requireNonNull(config, "config must not be null");
        this.minSamples = config.getMinSamples();
        this.slopeThreshold = config.getSlopeThreshold();
        if (minSamples < 2) {
            throw new IllegalArgumentException("trend minSamples must be >= 2, got: " + minSamples);
        }
        if (slopeThreshold < 0) {
            throw new IllegalArgumentException("trend slopeThreshold must be >= 0, got: " + slopeThreshold);
        }
    }

    @Override
    public Optional<Detection> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context.size() < minSamples) {
            return Optional.empty();
        }
        Optional<Double> baselineValue = context.baselineValue();
        if (baselineValue.isEmpty()) {
            return Optional.empty();
        }

        List<Double> values = context.values();
        double slope = Statistics.slope(values);
        if (!Double.isFinite(slope) || Math.abs(slope) <= slopeThreshold) {
            return Optional.empty();
        }

        double baseline = baselineValue.get();
        double current = values.get(values.size() - 1);
        double change = Statistics.changePercent(current, baseline);
        LOG.debug("{} fired: slope={}", context.getMetric().getKey(), slope);
        return Optional.of(new Detection(
                DetectionMethodType.TREND,
                baseline,
                current,
                change,
                Math.min(1.0, Math.abs(slope) * 10.0),
                String.format("%s trend detected: slope = %.4f",
                        slope > 0 ? "Increasing" : "Decreasing", slope)));
    }

    @Override
    public DetectionMethodType type() {
        return DetectionMethodType.TREND;
    }
}
