package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.model.MonitoredMetric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input to a {@link DetectionMethod}: one metric, an immutable window of its
 * samples (oldest first) and the baseline in force, if any.
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final MonitoredMetric metric;
    private final List<MetricSample> window;
    private final Baseline baseline;

    /**
     * @param metric   the metric under evaluation; must not be {@code null}
     * @param window   samples of that metric, oldest first; copied
     * @param baseline current baseline, or {@code null}
     */
    public DetectionContext(MonitoredMetric metric, List<MetricSample> window, Baseline baseline) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.window = List.copyOf(Objects.requireNonNull(window, "window must not be null"));
        this.baseline = baseline;
    }

    public MonitoredMetric getMetric() {
        return metric;
    }

    public List<MetricSample> getWindow() {
        return window;
    }

    public Optional<Baseline> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    /** @return the baseline value, if a baseline is in force */
    public Optional<Double> baselineValue() {
        return baseline == null ? Optional.empty() : Optional.of(baseline.getValue());
    }

    public int size() {
        return window.size();
    }

    /** @return the newest sample, or empty for an empty window */
    public Optional<MetricSample> latest() {
        return window.isEmpty() ? Optional.empty() : Optional.of(window.get(window.size() - 1));
    }

    /** @return sample values in window order */
    public List<Double> values() {
        List<Double> values = new ArrayList<>(window.size());
        for (MetricSample sample : window) {
            values.add(sample.getValue());
        }
        return values;
    }

    @Override
    public String toString() {
        return "DetectionContext{metric=" + metric.getKey() + ", samples=" + window.size()
                + ", baseline=" + (baseline != null ? baseline.getValue() : null) + '}';
    }
}
