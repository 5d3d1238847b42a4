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
 * Variance-normalized deviation of the window mean from the baseline.
 *
 * <p>
 * With sample mean {@code m}, sample standard deviation {@code s} and window
 * size {@code n}, the statistic {@code t = |m - baseline| / (s / sqrt(n))}
 * is compared against a critical value (1.96 by default, roughly 95%
 * two-sided). A constant window ({@code s == 0}) or a zero baseline makes the
 * method abstain.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalDetection implements DetectionMethod {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalDetection.class);

    private final int minSamples;
    private final double criticalValue;

    /**
     * @param config statistical method settings
     * @throws IllegalArgumentException if {@code minSamples < 2} or the
     *                                  critical value is not positive
     */
    public StatisticalDetection(MethodsConfig.Statistical config) {
        Objects.requireNonNull(config, "config must not be null");
        this.minSamples = config.getMinSamples();
        this.criticalValue = config.getCriticalValue();
        if (minSamples < 2) {
            throw new IllegalArgumentException("statistical minSamples must be >= 2, got: " + minSamples);
        }
        if (!(criticalValue > 0)) {
            throw new IllegalArgumentException("statistical criticalValue must be > 0, got: " + criticalValue);
        }
    }

    @Override
    public Optional<Detection> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context.size() < minSamples) {
            return Optional.empty();
        }
        Optional<Double> baselineValue = context.baselineValue();
        if (baselineValue.isEmpty() || baselineValue.get() == 0.0) {
            return Optional.empty();
        }
        double baseline = baselineValue.get();

        List<Double> values = context.values();
        double mean = Statistics.mean(values);
        double stdev = Statistics.sampleStdDev(values);
        if (!Double.isFinite(stdev) || stdev == 0.0) {
            return Optional.empty();
        }
        double t = Math.abs(mean - baseline) / (stdev / Math.sqrt(values.size()));
        if (!Double.isFinite(t) || t <= criticalValue) {
            return Optional.empty();
        }

        double change = Statistics.changePercent(mean, baseline);
        LOG.debug("{} fired: mean={} baseline={} t={}", context.getMetric().getKey(), mean, baseline, t);
        return Optional.of(new Detection(
                DetectionMethodType.STATISTICAL,
                baseline,
                mean,
                change,
                Math.min(1.0, Math.abs(change) / 100.0),
                String.format("Statistical regression detected: %.1f%% change from baseline (t=%.2f)", change, t)));
    }

    @Override
    public DetectionMethodType type() {
        return DetectionMethodType.STATISTICAL;
    }
}
