package com.qualitysentinel.core.buffer;

import com.qualitysentinel.core.model.MetricSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded, time-ordered sample history per component.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Any number of producer threads may {@link #append append} concurrently.
 * Each component's deque is guarded by its own lock, so writers to different
 * components never contend. Readers only ever receive immutable
 * {@link #snapshot snapshots}; they never observe the live deque.
 * </p>
 *
 * <h3>Eviction</h3>
 * <p>
 * When a component's history reaches {@code capacity}, the oldest sample is
 * evicted before the new one is appended.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleBuffer {

    private final ConcurrentMap<String, Deque<MetricSample>> samples = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;

    /**
     * @param capacity maximum samples kept per component; must be &gt;= 1
     * @param clock    clock used to resolve snapshot windows
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public SampleBuffer(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Append a sample to its component's history, evicting the oldest entry
     * when the history is full.
     *
     * @param sample the sample; must not be {@code null}
     */
    public void append(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        Deque<MetricSample> deque = samples.computeIfAbsent(sample.getComponentId(), k -> new ArrayDeque<>());
        synchronized (deque) {
            if (deque.size() >= capacity) {
                deque.pollFirst();
            }
            deque.addLast(sample);
        }
    }

    /**
     * Immutable copy of a component's samples recorded within {@code within}
     * of now, oldest first.
     *
     * @param componentId component to read
     * @param within      look-back window
     * @return immutable list; empty if the component is unknown
     */
    public List<MetricSample> snapshot(String componentId, Duration within) {
        return snapshot(componentId, null, within);
    }

    /**
     * Immutable copy of one metric's samples recorded within {@code within} of
     * now, oldest first.
     *
     * @param componentId component to read
     * @param metricName  metric to keep, or {@code null} for every metric
     * @param within      look-back window
     * @return immutable list; empty if the component is unknown
     */
    public List<MetricSample> snapshot(String componentId, String metricName, Duration within) {
        Objects.requireNonNull(within, "within must not be null");
        Deque<MetricSample> deque = samples.get(componentId);
        if (deque == null) {
            return List.of();
        }
        List<MetricSample> copy;
        synchronized (deque) {
            copy = new ArrayList<>(deque);
        }

        Instant cutoff = clock.instant().minus(within);
        List<MetricSample> result = new ArrayList<>(copy.size());
        for (MetricSample sample : copy) {
            if (sample.getTimestamp().isBefore(cutoff)) {
                continue;
            }
            if (metricName != null && !metricName.equals(sample.getMetricName())) {
                continue;
            }
            result.add(sample);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @param componentId component to inspect
     * @return current number of buffered samples for the component
     */
    public int size(String componentId) {
        Deque<MetricSample> deque = samples.get(componentId);
        if (deque == null) {
            return 0;
        }
        synchronized (deque) {
            return deque.size();
        }
    }

    /** @return total samples buffered across every component */
    public long totalSamples() {
        long total = 0;
        for (String componentId : samples.keySet()) {
            total += size(componentId);
        }
        return total;
    }

    public Set<String> componentIds() {
        return Collections.unmodifiableSet(samples.keySet());
    }

    public int getCapacity() {
        return capacity;
    }
}
