package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference value a metric is compared against.
 *
 * <p>
 * Baselines are never mutated: a refresh produces a new record. The current
 * baseline of a metric is the most recent one that has not expired.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"id", "componentId", "metricName", "value", "confidenceLow", "confidenceHigh",
        "sampleSize", "method", "createdAt", "validUntil"})
public final class Baseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String componentId;
    private final String metricName;
    private final double value;
    private final double confidenceLow;
    private final double confidenceHigh;
    private final int sampleSize;
    private final BaselineMethod method;
    private final Instant createdAt;
    private final Instant validUntil;

    private Baseline(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.componentId = Objects.requireNonNull(b.componentId, "componentId must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.value = b.value;
        this.confidenceLow = b.confidenceLow;
        this.confidenceHigh = b.confidenceHigh;
        this.sampleSize = b.sampleSize;
        this.method = Objects.requireNonNull(b.method, "method must not be null");
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.validUntil = b.validUntil;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Baseline}.
     */
    public static class Builder {
        private String id;
        private String componentId;
        private String metricName;
        private double value;
        private double confidenceLow;
        private double confidenceHigh;
        private int sampleSize;
        private BaselineMethod method;
        private Instant createdAt;
        private Instant validUntil;

        public Builder id(String id) {
            this.id = id;
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

        public Builder confidenceInterval(double low, double high) {
            this.confidenceLow = low;
            this.confidenceHigh = high;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder method(BaselineMethod method) {
            this.method = method;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder validUntil(Instant validUntil) {
            this.validUntil = validUntil;
            return this;
        }

        public Baseline build() {
            return new Baseline(this);
        }
    }

    /**
     * A baseline is valid when it has no expiry or its expiry lies strictly
     * after {@code now}.
     *
     * @param now the reference instant
     * @return {@code true} if this baseline may be used at {@code now}
     */
    public boolean isValidAt(Instant now) {
        return validUntil == null || validUntil.isAfter(now);
    }

    public String getId() {
        return id;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public double getConfidenceLow() {
        return confidenceLow;
    }

    public double getConfidenceHigh() {
        return confidenceHigh;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public BaselineMethod getMethod() {
        return method;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** @return the expiry instant; empty means the baseline never expires */
    public Optional<Instant> getValidUntil() {
        return Optional.ofNullable(validUntil);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "id='" + id + '\'' +
                ", metric=" + componentId + "." + metricName +
                ", value=" + value +
                ", ci=[" + confidenceLow + ", " + confidenceHigh + "]" +
                ", sampleSize=" + sampleSize +
                ", method=" + method +
                ", createdAt=" + createdAt +
                ", validUntil=" + validUntil +
                '}';
    }
}
