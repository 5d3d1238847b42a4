package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A detected quality regression.
 *
 * <p>
 * Events are immutable. The {@code regressionScore} is clamped to
 * {@code [0, 1]} at build time; a non-finite score is stored as {@code 0}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code category}, {@code componentId},
 * {@code metricName}, {@code detectionMethod}, {@code severity} and
 * {@code detectedAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"id", "category", "componentId", "metricName", "detectionMethod", "severity",
        "regressionScore", "baselineValue", "currentValue", "changePercentage", "detectedAt",
        "firstOccurrence", "description", "rootCause", "recommendedActions"})
public final class RegressionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final RegressionCategory category;
    private final String componentId;
    private final String metricName;
    private final DetectionMethodType detectionMethod;
    private final Severity severity;
    private final double regressionScore;
    private final double baselineValue;
    private final double currentValue;
    private final double changePercentage;
    private final Instant detectedAt;
    private final Instant firstOccurrence;
    private final String description;
    private final RootCauseAnalysis rootCause;
    private final List<String> recommendedActions;

    private RegressionEvent(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.category = Objects.requireNonNull(b.category, "category must not be null");
        this.componentId = Objects.requireNonNull(b.componentId, "componentId must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.detectionMethod = Objects.requireNonNull(b.detectionMethod, "detectionMethod must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.regressionScore = clampScore(b.regressionScore);
        this.baselineValue = b.baselineValue;
        this.currentValue = b.currentValue;
        this.changePercentage = b.changePercentage;
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.firstOccurrence = b.firstOccurrence != null ? b.firstOccurrence : b.detectedAt;
        this.description = b.description != null ? b.description : "";
        this.rootCause = b.rootCause != null ? b.rootCause : new RootCauseAnalysis(List.of(), 0.0);
        this.recommendedActions = b.recommendedActions != null ? List.copyOf(b.recommendedActions) : List.of();
    }

    static double clampScore(double score) {
        if (!Double.isFinite(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RegressionEvent}.
     */
    public static class Builder {
        private String id;
        private RegressionCategory category;
        private String componentId;
        private String metricName;
        private DetectionMethodType detectionMethod;
        private Severity severity;
        private double regressionScore;
        private double baselineValue;
        private double currentValue;
        private double changePercentage;
        private Instant detectedAt;
        private Instant firstOccurrence;
        private String description;
        private RootCauseAnalysis rootCause;
        private List<String> recommendedActions;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder category(RegressionCategory category) {
            this.category = category;
            return this;
        }

        public Builder key(MetricKey key) {
            this.componentId = key.getComponentId();
            this.metricName = key.getMetricName();
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

        public Builder detectionMethod(DetectionMethodType detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder regressionScore(double regressionScore) {
            this.regressionScore = regressionScore;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder changePercentage(double changePercentage) {
            this.changePercentage = changePercentage;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder firstOccurrence(Instant firstOccurrence) {
            this.firstOccurrence = firstOccurrence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder rootCause(RootCauseAnalysis rootCause) {
            this.rootCause = rootCause;
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions;
            return this;
        }

        /**
         * @return a new {@link RegressionEvent}
         * @throws NullPointerException if a required field is missing
         */
        public RegressionEvent build() {
            return new RegressionEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public RegressionCategory getCategory() {
        return category;
    }

    public String getComponentId() {
        return componentId;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricKey key() {
        return MetricKey.of(componentId, metricName);
    }

    public DetectionMethodType getDetectionMethod() {
        return detectionMethod;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getRegressionScore() {
        return regressionScore;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getChangePercentage() {
        return changePercentage;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Instant getFirstOccurrence() {
        return firstOccurrence;
    }

    public String getDescription() {
        return description;
    }

    public RootCauseAnalysis getRootCause() {
        return rootCause;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegressionEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "RegressionEvent{" +
                "id='" + id + '\'' +
                ", metric=" + componentId + "." + metricName +
                ", method=" + detectionMethod +
                ", severity=" + severity +
                ", score=" + regressionScore +
                ", change=" + String.format("%.2f%%", changePercentage) +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
