package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.DetectionMethodType;

import java.util.Objects;

/**
 * A candidate regression produced by one {@link DetectionMethod}, before
 * severity, root cause and identity are attached.
 *
 * @since 1.0.0
 */
public final class Detection {

    private final DetectionMethodType method;
    private final double baselineValue;
    private final double currentValue;
    private final double changePercentage;
    private final double score;
    private final String description;

    public Detection(DetectionMethodType method,
            double baselineValue,
            double currentValue,
            double changePercentage,
            double score,
            String description) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.baselineValue = baselineValue;
        this.currentValue = currentValue;
        this.changePercentage = changePercentage;
        this.score = score;
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    public DetectionMethodType getMethod() {
        return method;
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

    public double getScore() {
        return score;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Detection{method=" + method + ", baseline=" + baselineValue + ", current=" + currentValue
                + ", change=" + changePercentage + "%, score=" + score + '}';
    }
}
