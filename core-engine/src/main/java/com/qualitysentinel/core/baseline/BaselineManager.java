package com.qualitysentinel.core.baseline;

import com.qualitysentinel.core.analysis.Statistics;
import com.qualitysentinel.core.buffer.SampleBuffer;
import com.qualitysentinel.core.config.BaselineSettings;
import com.qualitysentinel.core.model.Baseline;
import com.qualitysentinel.core.model.BaselineMethod;
import com.qualitysentinel.core.model.MetricKey;
import com.qualitysentinel.core.model.MetricSample;
import com.qualitysentinel.core.registry.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the baseline history of every metric.
 *
 * <p>
 * Each metric's history is an immutable list, oldest first. Updates build a
 * new list and swap it in through {@link ConcurrentMap#compute}, so a reader
 * sees either the previous history or the new one.
 * </p>
 *
 * <h3>Automatic refresh</h3>
 * <p>
 * A refresh only commits when the stable window holds at least
 * {@code minSamples} samples and their coefficient of variation is below the
 * stability threshold. An unstable window leaves the previous baseline in
 * place.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineManager {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineManager.class);

    /** Half-width of the confidence interval given to manual baselines. */
    static final double MANUAL_INTERVAL_FRACTION = 0.05;

    private final ConcurrentMap<MetricKey, List<Baseline>> history = new ConcurrentHashMap<>();
    private final MetricRegistry registry;
    private final SampleBuffer buffer;
    private final BaselineSettings settings;
    private final Clock clock;

    public BaselineManager(MetricRegistry registry, SampleBuffer buffer, BaselineSettings settings, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * The baseline in force for a metric: the newest stored baseline that is
     * still valid, else the registered manual value.
     *
     * @param key the metric
     * @return the current baseline, or empty if the metric has none
     */
    public Optional<Baseline> current(MetricKey key) {
        Instant now = clock.instant();
        List<Baseline> stored = history.getOrDefault(key, List.of());
        for (int i = stored.size() - 1; i >= 0; i--) {
            Baseline candidate = stored.get(i);
            if (candidate.isValidAt(now)) {
                return Optional.of(candidate);
            }
        }
        return registry.lookup(key)
                .flatMap(metric -> metric.getManualBaseline()
                        .map(value -> manual(registeredId(metric.getKey()), metric.getKey(), value,
                                metric.getRegisteredAt())));
    }

    public Optional<Baseline> current(String componentId, String metricName) {
        return current(MetricKey.of(componentId, metricName));
    }

    /** @return stored history of a metric, oldest first */
    public List<Baseline> history(MetricKey key) {
        return history.getOrDefault(key, List.of());
    }

    /** @return number of stored baseline records across every metric */
    public int count() {
        int total = 0;
        for (List<Baseline> baselines : history.values()) {
            total += baselines.size();
        }
        return total;
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Store a caller-supplied baseline. Manual baselines never expire.
     *
     * <p>
     * Storing the value the newest manual baseline already holds is a no-op
     * and returns that baseline, so repeated registrations keep one record.
     * </p>
     *
     * @param key   the metric
     * @param value baseline value; must be finite
     * @return the stored baseline
     */
    public Baseline createManual(MetricKey key, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("manual baseline for " + key + " must be finite, got: " + value);
        }
        Baseline candidate = manual(UUID.randomUUID().toString(), key, value, clock.instant());
        AtomicReference<Baseline> stored = new AtomicReference<>(candidate);
        history.compute(key, (k, existing) -> {
            Optional<Baseline> unchanged = latestManual(existing)
                    .filter(b -> Double.compare(b.getValue(), value) == 0);
            if (unchanged.isPresent()) {
                stored.set(unchanged.get());
                return existing;
            }
            return appended(existing, candidate);
        });
        if (stored.get() == candidate) {
            LOG.info("Created manual baseline for {}: {}", key, value);
        } else {
            LOG.debug("Manual baseline for {} unchanged at {}", key, value);
        }
        return stored.get();
    }

    /**
     * Refresh a metric's automatic baseline if the update frequency has
     * elapsed since its latest stored baseline. A metric with no stored
     * baseline is always due.
     *
     * @param key the metric
     * @return the new baseline, or empty if not due or the window was unstable
     */
    public Optional<Baseline> maybeRefresh(MetricKey key) {
        List<Baseline> stored = history.getOrDefault(key, List.of());
        if (!stored.isEmpty()) {
            Instant latest = stored.get(stored.size() - 1).getCreatedAt();
            Instant due = latest.plus(settings.updateFrequency());
            if (clock.instant().isBefore(due)) {
                return Optional.empty();
            }
        }
        return refresh(key);
    }

    /**
     * Recompute a metric's automatic baseline from its stable window,
     * regardless of when it was last updated.
     *
     * @param key the metric
     * @return the new baseline, or empty if the window was too small or unstable
     */
    public Optional<Baseline> refresh(MetricKey key) {
        List<MetricSample> window = buffer.snapshot(
                key.getComponentId(), key.getMetricName(), settings.stableWindow());
        if (window.size() < settings.getMinSamples()) {
            LOG.debug("Baseline refresh skipped for {}: {} samples, need {}",
                    key, window.size(), settings.getMinSamples());
            return Optional.empty();
        }

        List<Double> values = new ArrayList<>(window.size());
        for (MetricSample sample : window) {
            values.add(sample.getValue());
        }
        double mean = Statistics.mean(values);
        double stdev = Statistics.sampleStdDev(values);
        if (mean == 0.0 || !Double.isFinite(mean) || !Double.isFinite(stdev)) {
            LOG.debug("Baseline refresh skipped for {}: mean={} stdev={}", key, mean, stdev);
            return Optional.empty();
        }
        double cv = stdev / Math.abs(mean);
        if (cv >= settings.getStabilityThreshold()) {
            LOG.debug("Baseline refresh skipped for {}: unstable window (cv={})", key, cv);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Baseline baseline = Baseline.builder()
                .id(UUID.randomUUID().toString())
                .key(key)
                .value(mean)
                .confidenceInterval(mean - 2 * stdev, mean + 2 * stdev)
                .sampleSize(values.size())
                .method(BaselineMethod.AUTOMATIC)
                .createdAt(now)
                .validUntil(now.plus(settings.validity()))
                .build();
        append(key, baseline);
        LOG.info("Updated automatic baseline for {}: {} (n={}, cv={})",
                key, String.format("%.4f", mean), values.size(), String.format("%.4f", cv));
        return Optional.of(baseline);
    }

    /**
     * Drop automatic baselines that have expired and were created before
     * {@code before}. Manual baselines are kept.
     *
     * @param before retention cut-off
     * @return number of baselines removed
     */
    public int prune(Instant before) {
        Instant now = clock.instant();
        int removed = 0;
        for (MetricKey key : history.keySet()) {
            List<Baseline> current = history.get(key);
            if (current == null) {
                continue;
            }
            List<Baseline> kept = new ArrayList<>(current.size());
            for (Baseline baseline : current) {
                boolean stale = baseline.getMethod() == BaselineMethod.AUTOMATIC
                        && !baseline.isValidAt(now)
                        && baseline.getCreatedAt().isBefore(before);
                if (!stale) {
                    kept.add(baseline);
                }
            }
            if (kept.size() != current.size()) {
                // Only swap if nobody appended in the meantime
                if (history.replace(key, current, List.copyOf(kept))) {
                    removed += current.size() - kept.size();
                }
            }
        }
        return removed;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void append(MetricKey key, Baseline baseline) {
        history.compute(key, (k, existing) -> appended(existing, baseline));
    }

    private static List<Baseline> appended(List<Baseline> existing, Baseline baseline) {
        List<Baseline> next = new ArrayList<>(existing != null ? existing.size() + 1 : 1);
        if (existing != null) {
            next.addAll(existing);
        }
        next.add(baseline);
        return List.copyOf(next);
    }

    private static Optional<Baseline> latestManual(List<Baseline> existing) {
        if (existing == null) {
            return Optional.empty();
        }
        for (int i = existing.size() - 1; i >= 0; i--) {
            if (existing.get(i).getMethod() == BaselineMethod.MANUAL) {
                return Optional.of(existing.get(i));
            }
        }
        return Optional.empty();
    }

    private static String registeredId(MetricKey key) {
        return UUID.nameUUIDFromBytes(("manual:" + key).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Baseline manual(String id, MetricKey key, double value, Instant createdAt) {
        double halfWidth = Math.abs(value) * MANUAL_INTERVAL_FRACTION;
        return Baseline.builder()
                .id(id)
                .key(key)
                .value(value)
                .confidenceInterval(value - halfWidth, value + halfWidth)
                .sampleSize(1)
                .method(BaselineMethod.MANUAL)
                .createdAt(createdAt)
                .validUntil(null)
                .build();
    }
}
