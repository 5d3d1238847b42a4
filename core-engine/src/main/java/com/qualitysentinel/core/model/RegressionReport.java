package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated view of the regressions detected in a time period.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"id", "periodStart", "periodEnd", "totalRegressions", "bySeverity", "byCategory",
        "affectedComponents", "trendAnalysis", "recommendations", "createdAt", "events"})
public final class RegressionReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final Instant periodStart;
    private final Instant periodEnd;
    private final int totalRegressions;
    private final Map<Severity, Integer> bySeverity;
    private final Map<RegressionCategory, Integer> byCategory;
    private final Set<String> affectedComponents;
    private final List<RegressionEvent> events;
    private final TrendAnalysis trendAnalysis;
    private final List<String> recommendations;
    private final Instant createdAt;

    private RegressionReport(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.periodStart = Objects.requireNonNull(b.periodStart, "periodStart must not be null");
        this.periodEnd = Objects.requireNonNull(b.periodEnd, "periodEnd must not be null");
        this.events = b.events != null ? List.copyOf(b.events) : List.of();
        this.totalRegressions = events.size();
        this.bySeverity = b.bySeverity != null
                ? Collections.unmodifiableMap(new EnumMap<>(b.bySeverity))
                : Map.of();
        this.byCategory = b.byCategory != null
                ? Collections.unmodifiableMap(new EnumMap<>(b.byCategory))
                : Map.of();
        this.affectedComponents = b.affectedComponents != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(b.affectedComponents))
                : Set.of();
        this.trendAnalysis = b.trendAnalysis != null ? b.trendAnalysis : TrendAnalysis.empty();
        this.recommendations = b.recommendations != null ? List.copyOf(b.recommendations) : List.of();
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RegressionReport}. The total is derived from
     * the event list.
     */
    public static class Builder {
        private String id;
        private Instant periodStart;
        private Instant periodEnd;
        private Map<Severity, Integer> bySeverity;
        private Map<RegressionCategory, Integer> byCategory;
        private Set<String> affectedComponents;
        private List<RegressionEvent> events;
        private TrendAnalysis trendAnalysis;
        private List<String> recommendations;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder period(Instant start, Instant end) {
            this.periodStart = start;
            this.periodEnd = end;
            return this;
        }

        public Builder bySeverity(Map<Severity, Integer> bySeverity) {
            this.bySeverity = bySeverity;
            return this;
        }

        public Builder byCategory(Map<RegressionCategory, Integer> byCategory) {
            this.byCategory = byCategory;
            return this;
        }

        public Builder affectedComponents(Set<String> affectedComponents) {
            this.affectedComponents = affectedComponents;
            return this;
        }

        public Builder events(List<RegressionEvent> events) {
            this.events = events;
            return this;
        }

        public Builder trendAnalysis(TrendAnalysis trendAnalysis) {
            this.trendAnalysis = trendAnalysis;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RegressionReport build() {
            return new RegressionReport(this);
        }
    }

    public String getId() {
        return id;
    }

    public Instant getPeriodStart() {
        return periodStart;
    }

    public Instant getPeriodEnd() {
        return periodEnd;
    }

    public int getTotalRegressions() {
        return totalRegressions;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<RegressionCategory, Integer> getByCategory() {
        return byCategory;
    }

    public Set<String> getAffectedComponents() {
        return affectedComponents;
    }

    public List<RegressionEvent> getEvents() {
        return events;
    }

    public TrendAnalysis getTrendAnalysis() {
        return trendAnalysis;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegressionReport that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "RegressionReport{" +
                "id='" + id + '\'' +
                ", period=[" + periodStart + ", " + periodEnd + "]" +
                ", totalRegressions=" + totalRegressions +
                ", affectedComponents=" + affectedComponents +
                '}';
    }
}
