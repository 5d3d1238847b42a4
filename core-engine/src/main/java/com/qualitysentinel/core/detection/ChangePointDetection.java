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
 * Mean shift between the two halves of the window.
 *
 * <p>
 * The window is split at {@code n / 2}; the method fires when the relative
 * change from the first-half mean to the second-half mean exceeds the change
 * threshold (a fraction, {@code 0.20} by default). A zero first-half mean
 * makes it abstain. Works without a registered baseline: the first-half mean
 * stands in for it.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetection implements DetectionMethod {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetection.class);

    private final int minSamples;
    private final double changeThreshold;

    public ChangePointDetection(MethodsConfig.ChangePoint config) {
        Objects.requireNonNull(config, "config must not be null");
        this.minSamples = config.getMinSamples();
        this.changeThreshold = config.getChangeThreshold();
        if (minSamples < 4) {
            throw new IllegalArgumentException("changePoint minSamples must be >= 4, got: " + minSamples);
        }
        if (changeThreshold < 0) {
            throw new IllegalArgumentException("changePoint changeThreshold must be >= 0, got: " + changeThreshold);
        }
    }

    @Override
    public Optional<Detection> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context.size() < minSamples) {
            return Optional.empty();
        }

        List<Double> values = context.values();
        int mid = values.size() / 2;
        double firstMean = Statistics.mean(values.subList(0, mid));
        double secondMean = Statistics.mean(values.subList(mid, values.size()));
        if (firstMean == 0.0 || !Double.isFinite(firstMean) || !Double.isFinite(secondMean)) {
            return Optional.empty();
        }

        double relative = Math.abs(secondMean - firstMean) / Math.abs(firstMean);
        if (relative <= changeThreshold) {
            return Optional.empty();
        }

        double change = (secondMean - firstMean) / firstMean * 100.0;
        double baseline = context.baselineValue().orElse(firstMean);
        LOG.debug("{} fired: first={} second={}", context.getMetric().getKey(), firstMean, secondMean);
        return Optional.of(new Detection(
                DetectionMethodType.CHANGE_POINT,
                baseline,
                secondMean,
                change,
                Math.min(1.0, Math.abs(change) / 100.0),
                String.format("Change point detected: %.1f%% change", change)));
    }

    @Override
    public DetectionMethodType type() {
        return DetectionMethodType.CHANGE_POINT;
    }
}
