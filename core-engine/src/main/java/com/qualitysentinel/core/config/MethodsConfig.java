package com.qualitysentinel.core.config;

import com.qualitysentinel.core.model.DetectionMethodType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-method switches and constants for the five detection methods.
 *
 * <pre>
 * methods:
 *   threshold:
 *     enabled: true
 *   statistical:
 *     enabled: true
 *     minSamples: 10
 *     criticalValue: 1.96
 *   trend:
 *     enabled: true
 *     minSamples: 5
 *     slopeThreshold: 0.1
 *   changePoint:
 *     enabled: true
 *     minSamples: 10
 *     changeThreshold: 0.20
 *   anomaly:
 *     enabled: true
 *     minSamples: 5
 *     anomalyThreshold: 2.5
 *     recentCount: 3
 *     minAnomalies: 2
 * </pre>
 *
 * @since 1.0.0
 */
public class MethodsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Toggle threshold = new Toggle();
    private Statistical statistical = new Statistical();
    private Trend trend = new Trend();
    private ChangePoint changePoint = new ChangePoint();
    private Anomaly anomaly = new Anomaly();

    /**
     * @param type a detection method
     * @return {@code true} if the method is switched on
     */
    public boolean isEnabled(DetectionMethodType type) {
        return switch (type) {
            case THRESHOLD -> threshold.isEnabled();
            case STATISTICAL -> statistical.isEnabled();
            case TREND -> trend.isEnabled();
            case CHANGE_POINT -> changePoint.isEnabled();
            case ANOMALY -> anomaly.isEnabled();
        };
    }

    /** @return enabled methods in declaration order */
    public List<DetectionMethodType> enabledMethods() {
        List<DetectionMethodType> enabled = new ArrayList<>();
        for (DetectionMethodType type : DetectionMethodType.values()) {
            if (isEnabled(type)) {
                enabled.add(type);
            }
        }
        return enabled;
    }

    void validate(List<String> errors) {
        if (statistical.getMinSamples() < 2) {
            errors.add("methods.statistical.minSamples must be >= 2, got: " + statistical.getMinSamples());
        }
        if (statistical.getCriticalValue() <= 0) {
            errors.add("methods.statistical.criticalValue must be > 0, got: " + statistical.getCriticalValue());
        }
        if (trend.getMinSamples() < 2) {
            errors.add("methods.trend.minSamples must be >= 2, got: " + trend.getMinSamples());
        }
        if (trend.getSlopeThreshold() < 0) {
            errors.add("methods.trend.slopeThreshold must be >= 0, got: " + trend.getSlopeThreshold());
        }
        if (changePoint.getMinSamples() < 4) {
            errors.add("methods.changePoint.minSamples must be >= 4, got: " + changePoint.getMinSamples());
        }
        if (changePoint.getChangeThreshold() <= 0) {
            errors.add("methods.changePoint.changeThreshold must be > 0, got: " + changePoint.getChangeThreshold());
        }
        if (anomaly.getMinSamples() < 2) {
            errors.add("methods.anomaly.minSamples must be >= 2, got: " + anomaly.getMinSamples());
        }
        if (anomaly.getAnomalyThreshold() <= 0) {
            errors.add("methods.anomaly.anomalyThreshold must be > 0, got: " + anomaly.getAnomalyThreshold());
        }
        if (anomaly.getRecentCount() < 1 || anomaly.getRecentCount() > anomaly.getMinSamples()) {
            errors.add("methods.anomaly.recentCount must be in [1, minSamples], got: " + anomaly.getRecentCount());
        }
        if (anomaly.getMinAnomalies() < 1 || anomaly.getMinAnomalies() > anomaly.getRecentCount()) {
            errors.add("methods.anomaly.minAnomalies must be in [1, recentCount], got: "
                    + anomaly.getMinAnomalies());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Toggle getThreshold() {
        return threshold;
    }

    public void setThreshold(Toggle threshold) {
        this.threshold = threshold != null ? threshold : new Toggle();
    }

    public Statistical getStatistical() {
        return statistical;
    }

    public void setStatistical(Statistical statistical) {
        this.statistical = statistical != null ? statistical : new Statistical();
    }

    public Trend getTrend() {
        return trend;
    }

    public void setTrend(Trend trend) {
        this.trend = trend != null ? trend : new Trend();
    }

    public ChangePoint getChangePoint() {
        return changePoint;
    }

    public void setChangePoint(ChangePoint changePoint) {
        this.changePoint = changePoint != null ? changePoint : new ChangePoint();
    }

    public Anomaly getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(Anomaly anomaly) {
        this.anomaly = anomaly != null ? anomaly : new Anomaly();
    }

    @Override
    public String toString() {
        return "MethodsConfig{enabled=" + enabledMethods() + '}';
    }

    // ---------------------------------------------------------------
    // Per-method settings
    // ---------------------------------------------------------------

    /** On/off switch shared by every method. */
    public static class Toggle implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /** Variance-normalized deviation test against the baseline. */
    public static class Statistical extends Toggle {

        private static final long serialVersionUID = 1L;

        private int minSamples = 10;
        /** Two-sided critical value; 1.96 is roughly 95 % confidence. */
        private double criticalValue = 1.96;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getCriticalValue() {
            return criticalValue;
        }

        public void setCriticalValue(double criticalValue) {
            this.criticalValue = criticalValue;
        }
    }

    /** Least-squares slope over the window. */
    public static class Trend extends Toggle {

        private static final long serialVersionUID = 1L;

        private int minSamples = 5;
        private double slopeThreshold = 0.1;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getSlopeThreshold() {
            return slopeThreshold;
        }

        public void setSlopeThreshold(double slopeThreshold) {
            this.slopeThreshold = slopeThreshold;
        }
    }

    /** Half-window mean comparison. */
    public static class ChangePoint extends Toggle {

        private static final long serialVersionUID = 1L;

        private int minSamples = 10;
        /** Relative change between the two halves, as a fraction (0.20 = 20 %). */
        private double changeThreshold = 0.20;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getChangeThreshold() {
            return changeThreshold;
        }

        public void setChangeThreshold(double changeThreshold) {
            this.changeThreshold = changeThreshold;
        }
    }

    /** Z-score outliers among the most recent samples. */
    public static class Anomaly extends Toggle {

        private static final long serialVersionUID = 1L;

        private int minSamples = 5;
        private double anomalyThreshold = 2.5;
        private int recentCount = 3;
        private int minAnomalies = 2;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getAnomalyThreshold() {
            return anomalyThreshold;
        }

        public void setAnomalyThreshold(double anomalyThreshold) {
            this.anomalyThreshold = anomalyThreshold;
        }

        public int getRecentCount() {
            return recentCount;
        }

        public void setRecentCount(int recentCount) {
            this.recentCount = recentCount;
        }

        public int getMinAnomalies() {
            return minAnomalies;
        }

        public void setMinAnomalies(int minAnomalies) {
            this.minAnomalies = minAnomalies;
        }
    }
}
