package com.qualitysentinel.core.registry;

import com.qualitysentinel.core.model.MetricKey;
import com.qualitysentinel.core.model.MonitoredMetric;
import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of monitored metrics keyed by {@link MetricKey}.
 *
 * <p>
 * Registration is an idempotent upsert: registering the same key again
 * replaces its configuration but keeps the original registration instant.
 * Lookups are O(1).
 * </p>
 *
 * @since 1.0.0
 */
public class MetricRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MetricRegistry.class);

    private final ConcurrentMap<MetricKey, MonitoredMetric> metrics = new ConcurrentHashMap<>();
    private final Clock clock;

    public MetricRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Register or update a metric.
     *
     * @param componentId    owning component; must not be blank
     * @param metricName     metric name; must not be blank
     * @param category       regression category; must not be {@code null}
     * @param manualBaseline caller-supplied baseline, or {@code null}
     * @param thresholds     static bounds, or {@code null}
     * @return the canonical key
     * @throws IllegalArgumentException if an identifier is blank or a value is
     *                                  not finite
     * @throws NullPointerException     if {@code category} is {@code null}
     */
    public MetricKey register(String componentId,
            String metricName,
            RegressionCategory category,
            Double manualBaseline,
            Thresholds thresholds) {
        MetricKey key = MetricKey.of(componentId, metricName);
        Objects.requireNonNull(category, "category must not be null");

        MonitoredMetric registered = metrics.compute(key, (k, existing) -> new MonitoredMetric(
                k,
                category,
                manualBaseline,
                thresholds,
                existing != null ? existing.getRegisteredAt() : clock.instant()));

        LOG.info("Registered quality metric: {} ({}) baseline={} thresholds={}",
                key, category.label(), manualBaseline, registered.getThresholds());
        return key;
    }

    public Optional<MonitoredMetric> lookup(MetricKey key) {
        return Optional.ofNullable(metrics.get(key));
    }

    public Optional<MonitoredMetric> lookup(String componentId, String metricName) {
        if (componentId == null || componentId.isBlank() || metricName == null || metricName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(metrics.get(MetricKey.of(componentId, metricName)));
    }

    public boolean isRegistered(MetricKey key) {
        return metrics.containsKey(key);
    }

    /**
     * @return snapshot of all registrations; not backed by the registry
     */
    public List<MonitoredMetric> all() {
        Collection<MonitoredMetric> values = metrics.values();
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public int size() {
        return metrics.size();
    }
}
