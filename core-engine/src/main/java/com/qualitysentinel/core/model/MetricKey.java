package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Canonical identity of a monitored metric: the pair
 * {@code (componentId, metricName)}.
 *
 * @since 1.0.0
 */
public final class MetricKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String componentId;
    private final String metricName;

    private MetricKey(String componentId, String metricName) {
        this.componentId = componentId;
        this.metricName = metricName;
    }

    /**
     * @param componentId owning component; must not be blank
     * @param metricName  metric name within the component; must not be blank
     * @return the key
     * @throws IllegalArgumentException if either part is null or blank
     */
    public static MetricKey of(String componentId, String metricName) {
        if (componentId == null || componentId.isBlank()) {
            throw new IllegalArgumentException("componentId must not be null or blank");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must not be null or blank");
        }
        return new MetricKey(componentId, metricName);
    }

    public String getComponentId() {
        return componentId;
    }

    public String getMetricName() {
        return metricName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricKey that))
            return false;
        return componentId.equals(that.componentId) && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(componentId, metricName);
    }

    @Override
    public String toString() {
        return componentId + "." + metricName;
    }
}
