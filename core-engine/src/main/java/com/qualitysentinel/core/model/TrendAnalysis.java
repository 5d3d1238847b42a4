package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Temporal summary of the regressions inside a report period.
 *
 * @since 1.0.0
 */
public final class TrendAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Direction of severity across the period. */
    public enum Direction {
        INCREASING,
        DECREASING,
        STABLE
    }

    private static final TrendAnalysis EMPTY = new TrendAnalysis(Duration.ZERO, Duration.ZERO, 0.0,
            Direction.STABLE, null, null, 0, Map.of());

    private final Duration totalDuration;
    private final Duration averageInterval;
    private final double eventsPerHour;
    private final Direction severityDirection;
    private final Severity dominantSeverity;
    private final String mostAffectedComponent;
    private final int mostAffectedCount;
    private final Map<String, Integer> componentDistribution;

    public TrendAnalysis(Duration totalDuration,
            Duration averageInterval,
            double eventsPerHour,
            Direction severityDirection,
            Severity dominantSeverity,
            String mostAffectedComponent,
            int mostAffectedCount,
            Map<String, Integer> componentDistribution) {
        this.totalDuration = Objects.requireNonNull(totalDuration, "totalDuration must not be null");
        this.averageInterval = Objects.requireNonNull(averageInterval, "averageInterval must not be null");
        this.eventsPerHour = eventsPerHour;
        this.severityDirection = Objects.requireNonNull(severityDirection, "severityDirection must not be null");
        this.dominantSeverity = dominantSeverity;
        this.mostAffectedComponent = mostAffectedComponent;
        this.mostAffectedCount = mostAffectedCount;
        this.componentDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(componentDistribution));
    }

    /** @return the analysis of an empty period */
    public static TrendAnalysis empty() {
        return EMPTY;
    }

    public Duration getTotalDuration() {
        return totalDuration;
    }

    public Duration getAverageInterval() {
        return averageInterval;
    }

    public double getEventsPerHour() {
        return eventsPerHour;
    }

    public Direction getSeverityDirection() {
        return severityDirection;
    }

    public Optional<Severity> getDominantSeverity() {
        return Optional.ofNullable(dominantSeverity);
    }

    public Optional<String> getMostAffectedComponent() {
        return Optional.ofNullable(mostAffectedComponent);
    }

    public int getMostAffectedCount() {
        return mostAffectedCount;
    }

    public Map<String, Integer> getComponentDistribution() {
        return componentDistribution;
    }

    @Override
    public String toString() {
        return "TrendAnalysis{" +
                "totalDuration=" + totalDuration +
                ", averageInterval=" + averageInterval +
                ", eventsPerHour=" + eventsPerHour +
                ", severityDirection=" + severityDirection +
                ", dominantSeverity=" + dominantSeverity +
                ", mostAffectedComponent='" + mostAffectedComponent + '\'' +
                ", mostAffectedCount=" + mostAffectedCount +
                '}';
    }
}
