package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded value of a monitored metric.
 *
 * <p>
 * Samples are immutable once built. The baseline and thresholds in force at
 * write time are captured alongside the value so that later baseline changes
 * do not alter how an old sample is interpreted.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code componentId} and
 * {@code metricName} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String componentId;
    private final String metricName;
    private final double value;
    private final Double baselineSnapshot;
    private final Thresholds thresholds;
    private final Map<String, Object> metadata;

    private MetricSample(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.componentId = Objects.requireNonNull(builder.componentId, "componentId must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.value = builder.value;
        this.baselineSnapshot = builder.baselineSnapshot;
        this.thresholds = builder.thresholds != null ? builder.thresholds : Thresholds.none();
        // Copied so callers cannot mutate a stored sample
        this.metadata = builder.metadata != null && !builder.metadata.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Collections.emptyMap();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricSample} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private String componentId;
        private String metricName;
        private double value;
        private Double baselineSnapshot;
        private Thresholds thresholds;
        private Map<String, Object> metadata;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder componentId(String componentId) {
            this.componentId = componentId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder key(MetricKey key) {
            this.componentId = key.getComponentId();
            this.metricName = key.getMetricName();
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder baselineSnapshot(Double baselineSnapshot) {
            this.baselineSnapshot = baselineSnapshot;
            return this;
        }

        public Builder thresholds(Thresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @return a new {@link MetricSample}
         * @throws NullPointerException if a required field is missing
         */
        public MetricSample build() {
            return new MetricSample(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricKey getKey() {
        return MetricKey.of(componentId, metricName);
    }

    public double getValue() {
        return value;
    }

    /**
     * @return the baseline value in force when this sample was written
     */
    public Optional<Double> getBaselineSnapshot() {
        return Optional.ofNullable(baselineSnapshot);
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    /**
     * @return unmodifiable opaque metadata
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && componentId.equals(that.componentId)
                && metricName.equals(that.metricName)
                && Objects.equals(baselineSnapshot, that.baselineSnapshot)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, componentId, metricName, value, baselineSnapshot, metadata);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "timestamp=" + timestamp +
                ", componentId='" + componentId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                ", baselineSnapshot=" + baselineSnapshot +
                '}';
    }
}
