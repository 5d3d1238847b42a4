package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Point-in-time counters describing the engine.
 *
 * @since 1.0.0
 */
public final class EngineStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int registeredMetrics;
    private final int baselineCount;
    private final long totalSamples;
    private final int eventCount;
    private final int reportCount;
    private final boolean detectionActive;
    private final Duration detectionInterval;
    private final List<DetectionMethodType> enabledMethods;

    public EngineStatus(int registeredMetrics,
            int baselineCount,
            long totalSamples,
            int eventCount,
            int reportCount,
            boolean detectionActive,
            Duration detectionInterval,
            List<DetectionMethodType> enabledMethods) {
        this.registeredMetrics = registeredMetrics;
        this.baselineCount = baselineCount;
        this.totalSamples = totalSamples;
        this.eventCount = eventCount;
        this.reportCount = reportCount;
        this.detectionActive = detectionActive;
        this.detectionInterval = detectionInterval;
        this.enabledMethods = List.copyOf(enabledMethods);
    }

    public int getRegisteredMetrics() {
        return registeredMetrics;
    }

    public int getBaselineCount() {
        return baselineCount;
    }

    public long getTotalSamples() {
        return totalSamples;
    }

    public int getEventCount() {
        return eventCount;
    }

    public int getReportCount() {
        return reportCount;
    }

    public boolean isDetectionActive() {
        return detectionActive;
    }

    public Duration getDetectionInterval() {
        return detectionInterval;
    }

    public List<DetectionMethodType> getEnabledMethods() {
        return enabledMethods;
    }

    @Override
    public String toString() {
        return "EngineStatus{" +
                "registeredMetrics=" + registeredMetrics +
                ", baselineCount=" + baselineCount +
                ", totalSamples=" + totalSamples +
                ", eventCount=" + eventCount +
                ", reportCount=" + reportCount +
                ", detectionActive=" + detectionActive +
                ", detectionInterval=" + detectionInterval +
                ", enabledMethods=" + enabledMethods +
                '}';
    }
}
