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
 * Z-score outliers among the most recent samples.
 *
 * <p>
 * Computes the population mean and standard deviation of the whole window,
 * then the z-score {@code |x - mean| / stdev} of each of the last
 * {@code recentCount} samples. Fires when at least {@code minAnomalies} of
 * them exceed the anomaly threshold; the score is the fraction of recent
 * samples that were outliers.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetection implements DetectionMethod {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetection.class);

    private final int minSamples;
    private final double anomalyThreshold;
    private final int recentCount;
    private final int minAnomalies;

    public AnomalyDetection(MethodsConfig.Anomaly config) {
        Objects.requireNonNull(config, "config must not be null");
        this.minSamples = config.getMinSamples();
        this.anomalyThreshold = config.getAnomalyThreshold();
        this.recentCount = config.getRecentCount();
        this.minAnomalies = config.getMinAnomalies();
        if (recentCount < 1 || minAnomalies < 1 || minAnomalies > recentCount) {
            throw new IllegalArgumentException("anomaly requires 1 <= minAnomalies <= recentCount, got: "
                    + minAnomalies + " / " + recentCount);
        }
        if (minSamples < recentCount) {
            throw new IllegalArgumentException(
                    "anomaly minSamples must be >= recentCount (" + recentCount + "), got: " + minSamples);
        }
    }

    @Override
    public Optional<Detection> evaluate(DetectionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context.size() < minSamples) {
            return Optional.empty();
        }

        List<Double> values = context.values();
        double mean = Statistics.mean(values);
        double stdev = Statistics.populationStdDev(values);
        if (!Double.isFinite(stdev) || stdev == 0.0) {
            return Optional.empty();
        }

        int anomalies = 0;
        for (double value : values.subList(values.size() - recentCount, values.size())) {
            if (Math.abs(value - mean) / stdev > anomalyThreshold) {
                anomalies++;
            }
        }
        if (anomalies < minAnomalies) {
            return Optional.empty();
        }

        double current = values.get(values.size() - 1);
        Optional<Double> baselineValue = context.baselineValue();
        double change = baselineValue.map(b -> Statistics.changePercent(current, b)).orElse(0.0);
        LOG.debug("{} fired: {} of {} recent samples beyond z={}",
                context.getMetric().getKey(), anomalies, recentCount, anomalyThreshold);
        return Optional.of(new Detection(
                DetectionMethodType.ANOMALY,
                baselineValue.orElse(mean),
                current,
                change,
                Math.min(1.0, (double) anomalies / recentCount),
                String.format("Multiple anomalies detected: %d out of %d recent values", anomalies, recentCount)));
    }

    @Override
    public DetectionMethodType type() {
        return DetectionMethodType.ANOMALY;
    }
}
