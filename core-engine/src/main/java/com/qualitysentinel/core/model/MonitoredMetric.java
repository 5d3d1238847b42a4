package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Monitoring configuration of one registered metric.
 *
 * @since 1.0.0
 */
public final class MonitoredMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MetricKey key;
    private final RegressionCategory category;
    private final Double manualBaseline;
    private final Thresholds thresholds;
    private final Instant registeredAt;

    /**
     * @param key            metric identity; must not be {@code null}
     * @param category       regression category; must not be {@code null}
     * @param manualBaseline caller-supplied baseline, or {@code null}
     * @param thresholds     static bounds, or {@code null} for none
     * @param registeredAt   registration instant; must not be {@code null}
     */
    public MonitoredMetric(MetricKey key,
            RegressionCategory category,
            Double manualBaseline,
            Thresholds thresholds,
            Instant registeredAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        if (manualBaseline != null && !Double.isFinite(manualBaseline)) {
            throw new IllegalArgumentException(
                    "manual baseline for " + key + " must be finite, got: " + manualBaseline);
        }
        this.manualBaseline = manualBaseline;
        this.thresholds = thresholds != null ? thresholds : Thresholds.none();
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt must not be null");
    }

    public MetricKey getKey() {
        return key;
    }

    public String getComponentId() {
        return key.getComponentId();
    }

    public String getMetricName() {
        return key.getMetricName();
    }

    public RegressionCategory getCategory() {
        return category;
    }

    public Optional<Double> getManualBaseline() {
        return Optional.ofNullable(manualBaseline);
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoredMetric that))
            return false;
        return key.equals(that.key)
                && category == that.category
                && Objects.equals(manualBaseline, that.manualBaseline)
                && thresholds.equals(that.thresholds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, category, manualBaseline, thresholds);
    }

    @Override
    public String toString() {
        return "MonitoredMetric{" +
                "key=" + key +
                ", category=" + category +
                ", manualBaseline=" + manualBaseline +
                ", thresholds=" + thresholds +
                ", registeredAt=" + registeredAt +
                '}';
    }
}
