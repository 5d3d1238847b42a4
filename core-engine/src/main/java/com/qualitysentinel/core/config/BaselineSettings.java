package com.qualitysentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Automatic baseline maintenance.
 *
 * <pre>
 * baseline:
 *   autoUpdate: true
 *   updateFrequencySeconds: 86400
 *   stableWindowSeconds: 3600
 *   stabilityThreshold: 0.1
 *   minSamples: 10
 *   validitySeconds: 86400
 * </pre>
 *
 * @since 1.0.0
 */
public class BaselineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean autoUpdate = true;
    private long updateFrequencySeconds = 86_400;
    private long stableWindowSeconds = 3_600;
    /** Maximum coefficient of variation for a window to count as stable. */
    private double stabilityThreshold = 0.1;
    private int minSamples = 10;
    private long validitySeconds = 86_400;

    void validate(List<String> errors) {
        if (updateFrequencySeconds <= 0) {
            errors.add("baseline.updateFrequencySeconds must be > 0, got: " + updateFrequencySeconds);
        }
        if (stableWindowSeconds <= 0) {
            errors.add("baseline.stableWindowSeconds must be > 0, got: " + stableWindowSeconds);
        }
        if (stabilityThreshold <= 0) {
            errors.add("baseline.stabilityThreshold must be > 0, got: " + stabilityThreshold);
        }
        if (minSamples < 2) {
            errors.add("baseline.minSamples must be >= 2, got: " + minSamples);
        }
        if (validitySeconds <= 0) {
            errors.add("baseline.validitySeconds must be > 0, got: " + validitySeconds);
        }
    }

    public Duration updateFrequency() {
        return Duration.ofSeconds(updateFrequencySeconds);
    }

    public Duration stableWindow() {
        return Duration.ofSeconds(stableWindowSeconds);
    }

    public Duration validity() {
        return Duration.ofSeconds(validitySeconds);
    }

    public boolean isAutoUpdate() {
        return autoUpdate;
    }

    public void setAutoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
    }

    public long getUpdateFrequencySeconds() {
        return updateFrequencySeconds;
    }

    public void setUpdateFrequencySeconds(long updateFrequencySeconds) {
        this.updateFrequencySeconds = updateFrequencySeconds;
    }

    public long getStableWindowSeconds() {
        return stableWindowSeconds;
    }

    public void setStableWindowSeconds(long stableWindowSeconds) {
        this.stableWindowSeconds = stableWindowSeconds;
    }

    public double getStabilityThreshold() {
        return stabilityThreshold;
    }

    public void setStabilityThreshold(double stabilityThreshold) {
        this.stabilityThreshold = stabilityThreshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public long getValiditySeconds() {
        return validitySeconds;
    }

    public void setValiditySeconds(long validitySeconds) {
        this.validitySeconds = validitySeconds;
    }

    @Override
    public String toString() {
        return "BaselineSettings{" +
                "autoUpdate=" + autoUpdate +
                ", updateFrequencySeconds=" + updateFrequencySeconds +
                ", stableWindowSeconds=" + stableWindowSeconds +
                ", stabilityThreshold=" + stabilityThreshold +
                ", minSamples=" + minSamples +
                ", validitySeconds=" + validitySeconds +
                '}';
    }
}
