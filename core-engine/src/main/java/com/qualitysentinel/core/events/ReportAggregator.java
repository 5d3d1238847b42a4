package com.qualitysentinel.core.events;

import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.RegressionReport;
import com.qualitysentinel.core.model.Severity;
import com.qualitysentinel.core.model.TrendAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Summarizes the events of a time period into a {@link RegressionReport} and
 * keeps generated reports by id.
 *
 * <h3>Trend analysis</h3>
 * <p>
 * Events are ordered by detection time. The severity direction compares the
 * mean severity rank of the first half of the period's events with that of
 * the second half. The dominant severity is the most frequent one (ties go to
 * the more severe tier); the most affected component is the one with the most
 * events (ties go to the alphabetically first).
 * </p>
 *
 * @since 1.0.0
 */
public class ReportAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(ReportAggregator.class);

    static final String NO_REGRESSIONS = "No regressions detected in the analysis period";

    private static final List<String> GENERIC_RECOMMENDATIONS = List.of(
            "Review recent system changes and deployments",
            "Strengthen monitoring for affected components",
            "Consider implementing additional quality gates",
            "Update regression detection thresholds if necessary");

    private final ConcurrentMap<String, RegressionReport> reports = new ConcurrentHashMap<>();
    private final EventStore eventStore;
    private final Clock clock;

    public ReportAggregator(EventStore eventStore, Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Build and store a report of the events detected in {@code [start, end]}.
     *
     * @param start inclusive period start
     * @param end   inclusive period end
     * @return the stored report
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public RegressionReport generate(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("report start " + start + " is after end " + end);
        }

        List<RegressionEvent> events = eventStore.between(start, end);

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        Map<RegressionCategory, Integer> byCategory = new EnumMap<>(RegressionCategory.class);
        for (RegressionCategory category : RegressionCategory.values()) {
            byCategory.put(category, 0);
        }
        Set<String> components = new LinkedHashSet<>();
        for (RegressionEvent event : events) {
            bySeverity.merge(event.getSeverity(), 1, Integer::sum);
            byCategory.merge(event.getCategory(), 1, Integer::sum);
            components.add(event.getComponentId());
        }

        TrendAnalysis trend = analyzeTrend(events);
        RegressionReport report = RegressionReport.builder()
                .id(UUID.randomUUID().toString())
                .period(start, end)
                .bySeverity(bySeverity)
                .byCategory(byCategory)
                .affectedComponents(components)
                .events(events)
                .trendAnalysis(trend)
                .recommendations(recommend(events, bySeverity, byCategory, trend))
                .createdAt(clock.instant())
                .build();

        reports.put(report.getId(), report);
        LOG.info("Generated regression report {}: {} regressions across {} components ({} .. {})",
                report.getId(), report.getTotalRegressions(), components.size(), start, end);
        return report;
    }

    public Optional<RegressionReport> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(reports.get(id));
    }

    public int size() {
        return reports.size();
    }

    /**
     * Drop reports created before {@code before}.
     *
     * @return number of reports removed
     */
    public int prune(Instant before) {
        int sizeBefore = reports.size();
        reports.values().removeIf(report -> report.getCreatedAt().isBefore(before));
        return Math.max(0, sizeBefore - reports.size());
    }

    // ---------------------------------------------------------------
    // Trend analysis
    // ---------------------------------------------------------------

    TrendAnalysis analyzeTrend(List<RegressionEvent> events) {
        if (events.isEmpty()) {
            return TrendAnalysis.empty();
        }
        int n = events.size();
        Instant first = events.get(0).getDetectedAt();
        Instant last = events.get(n - 1).getDetectedAt();
        Duration total = Duration.between(first, last);
        Duration averageInterval = n > 1 ? total.dividedBy(n - 1) : Duration.ZERO;
        double hours = total.toMillis() / 3_600_000.0;
        double perHour = n / Math.max(1.0, hours);

        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        Map<String, Integer> distribution = new TreeMap<>();
        for (RegressionEvent event : events) {
            severityCounts.merge(event.getSeverity(), 1, Integer::sum);
            distribution.merge(event.getComponentId(), 1, Integer::sum);
        }

        Severity dominant = null;
        int dominantCount = 0;
        for (Map.Entry<Severity, Integer> entry : severityCounts.entrySet()) {
            // EnumMap iterates mildest first, so >= lets the more severe tier win ties
            if (entry.getValue() >= dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }

        String mostAffected = null;
        int mostAffectedCount = 0;
        for (Map.Entry<String, Integer> entry : distribution.entrySet()) {
            if (entry.getValue() > mostAffectedCount) {
                mostAffected = entry.getKey();
                mostAffectedCount = entry.getValue();
            }
        }

        return new TrendAnalysis(total, averageInterval, perHour, severityDirection(events),
                dominant, mostAffected, mostAffectedCount, distribution);
    }

    private static TrendAnalysis.Direction severityDirection(List<RegressionEvent> events) {
        int n = events.size();
        if (n < 2) {
            return TrendAnalysis.Direction.STABLE;
        }
        int mid = n / 2;
        double firstRank = meanRank(events.subList(0, mid));
        double secondRank = meanRank(events.subList(mid, n));
        if (secondRank > firstRank) {
            return TrendAnalysis.Direction.INCREASING;
        }
        if (secondRank < firstRank) {
            return TrendAnalysis.Direction.DECREASING;
        }
        return TrendAnalysis.Direction.STABLE;
    }

    private static double meanRank(List<RegressionEvent> events) {
        double sum = 0;
        for (RegressionEvent event : events) {
            sum += event.getSeverity().ordinal();
        }
        return sum / events.size();
    }

    // ---------------------------------------------------------------
    // Recommendations
    // ---------------------------------------------------------------

    private static List<String> recommend(List<RegressionEvent> events,
            Map<Severity, Integer> bySeverity,
            Map<RegressionCategory, Integer> byCategory,
            TrendAnalysis trend) {
        if (events.isEmpty()) {
            return List.of(NO_REGRESSIONS);
        }
        List<String> recommendations = new ArrayList<>();
        int critical = bySeverity.get(Severity.CRITICAL);
        int major = bySeverity.get(Severity.MAJOR);
        if (critical > 0) {
            recommendations.add("URGENT: " + critical + " critical regressions require immediate attention");
        }
        if (major > 0) {
            recommendations.add("HIGH PRIORITY: " + major + " major regressions need investigation");
        }
        if (trend.getMostAffectedCount() > 1) {
            recommendations.add("Focus investigation on component '" + trend.getMostAffectedComponent().orElse("")
                    + "' with " + trend.getMostAffectedCount() + " regressions");
        }

        RegressionCategory primary = null;
        int primaryCount = 0;
        for (Map.Entry<RegressionCategory, Integer> entry : byCategory.entrySet()) {
            if (entry.getValue() > primaryCount) {
                primary = entry.getKey();
                primaryCount = entry.getValue();
            }
        }
        if (primary != null) {
            recommendations.add("Primary regression category: " + primary.label()
                    + " (" + primaryCount + " occurrences)");
        }

        recommendations.addAll(GENERIC_RECOMMENDATIONS);
        return recommendations;
    }
}
