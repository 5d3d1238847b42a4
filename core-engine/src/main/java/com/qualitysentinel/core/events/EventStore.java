package com.qualitysentinel.core.events;

import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory keyed store of detected regressions.
 *
 * <p>
 * Events are written by the detection worker and by producer threads (arrival
 * checks) and read by report and query callers, so both indexes are
 * concurrent maps. Query results are copies, newest first.
 * </p>
 *
 * @since 1.0.0
 */
public class EventStore {

    /** Newest first; ties broken by id so the order is stable. */
    static final Comparator<RegressionEvent> NEWEST_FIRST = Comparator
            .comparing(RegressionEvent::getDetectedAt).reversed()
            .thenComparing(RegressionEvent::getId);

    private final ConcurrentMap<String, RegressionEvent> events = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RegressionEvent> latestBySource = new ConcurrentHashMap<>();

    /**
     * @param event the event to store; must not be {@code null}
     */
    public void record(RegressionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        events.put(event.getId(), event);
        latestBySource.merge(sourceKey(event.getComponentId(), event.getMetricName(), event.getDetectionMethod()),
                event,
                (existing, incoming) -> incoming.getDetectedAt().isBefore(existing.getDetectedAt())
                        ? existing
                        : incoming);
    }

    public Optional<RegressionEvent> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(events.get(id));
    }

    /**
     * Filter stored events. Every argument is optional.
     *
     * @param componentId only events of this component, or {@code null}
     * @param severity    only events of exactly this severity, or {@code null}
     * @param since       only events detected at or after this instant, or
     *                    {@code null}
     * @return matching events, newest first
     */
    public List<RegressionEvent> query(String componentId, Severity severity, Instant since) {
        List<RegressionEvent> result = new ArrayList<>();
        for (RegressionEvent event : events.values()) {
            if (componentId != null && !componentId.equals(event.getComponentId())) {
                continue;
            }
            if (severity != null && severity != event.getSeverity()) {
                continue;
            }
            if (since != null && event.getDetectedAt().isBefore(since)) {
                continue;
            }
            result.add(event);
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    /**
     * Events with {@code start <= detectedAt <= end}, oldest first.
     */
    public List<RegressionEvent> between(Instant start, Instant end) {
        List<RegressionEvent> result = new ArrayList<>();
        for (RegressionEvent event : events.values()) {
            Instant at = event.getDetectedAt();
            if (!at.isBefore(start) && !at.isAfter(end)) {
                result.add(event);
            }
        }
        result.sort(NEWEST_FIRST.reversed());
        return result;
    }

    /**
     * @return the most recent event raised by {@code method} for the given
     *         metric, if any is still stored
     */
    public Optional<RegressionEvent> lastEvent(String componentId, String metricName, DetectionMethodType method) {
        return Optional.ofNullable(latestBySource.get(sourceKey(componentId, metricName, method)));
    }

    public List<RegressionEvent> all() {
        return query(null, null, null);
    }

    public int size() {
        return events.size();
    }

    /**
     * Drop events detected before {@code before}.
     *
     * @return number of events removed
     */
    public int prune(Instant before) {
        int sizeBefore = events.size();
        events.values().removeIf(event -> event.getDetectedAt().isBefore(before));
        latestBySource.values().removeIf(event -> event.getDetectedAt().isBefore(before));
        return Math.max(0, sizeBefore - events.size());
    }

    private static String sourceKey(String componentId, String metricName, DetectionMethodType method) {
        return componentId + '\u0000' + metricName + '\u0000' + method;
    }
}
