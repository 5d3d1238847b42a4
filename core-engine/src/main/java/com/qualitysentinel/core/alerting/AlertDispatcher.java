package com.qualitysentinel.core.alerting;

import com.qualitysentinel.core.config.AlertingSettings;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Logs every stored regression and notifies listeners of those that match the
 * alerting policy.
 *
 * <h3>Policy</h3>
 * <ul>
 *   <li>Only severities listed in {@code alerting.alertOnSeverity} notify.</li>
 *   <li>After a notification, the same component, metric and method stay
 *       quiet for the cooldown period.</li>
 * </ul>
 * <p>
 * Listener exceptions are caught and logged; one failing listener does not
 * stop the others.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<RegressionListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<String, Instant> lastNotified = new ConcurrentHashMap<>();
    private final boolean enabled;
    private final Set<Severity> alertSeverities;
    private final Duration cooldown;
    private final Clock clock;

    public AlertDispatcher(AlertingSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.enabled = settings.isEnabled();
        this.alertSeverities = Set.copyOf(settings.alertSeverities());
        this.cooldown = settings.cooldown();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void addListener(RegressionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(RegressionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Log the event and, if the policy allows, notify every listener.
     *
     * @param event a stored regression
     * @return {@code true} if listeners were notified
     */
    public boolean dispatch(RegressionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        logEvent(event);

        if (!enabled || !alertSeverities.contains(event.getSeverity())) {
            return false;
        }
        if (!acquireSlot(event)) {
            LOG.debug("Alert for {}.{} ({}) suppressed by cooldown",
                    event.getComponentId(), event.getMetricName(), event.getDetectionMethod().label());
            return false;
        }

        LOG.info("Alert triggered for regression: {}", event.getId());
        for (RegressionListener listener : listeners) {
            try {
                listener.onRegression(event);
            } catch (RuntimeException e) {
                LOG.error("Regression listener {} failed for event {}: {}",
                        listener.getClass().getName(), event.getId(), e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Claims the notification slot for the event's source if its cooldown
     * has elapsed.
     */
    private boolean acquireSlot(RegressionEvent event) {
        String source = event.getComponentId() + '\u0000' + event.getMetricName()
                + '\u0000' + event.getDetectionMethod();
        Instant now = clock.instant();
        boolean[] acquired = {false};
        lastNotified.compute(source, (k, previous) -> {
            if (previous == null || !now.isBefore(previous.plus(cooldown))) {
                acquired[0] = true;
                return now;
            }
            return previous;
        });
        return acquired[0];
    }

    private static void logEvent(RegressionEvent event) {
        String pattern = "Quality regression detected: {}.{} ({}, {}) - {}% change";
        Object[] args = {
                event.getComponentId(),
                event.getMetricName(),
                event.getSeverity().label(),
                event.getDetectionMethod().label(),
                String.format("%.1f", event.getChangePercentage())
        };
        switch (event.getSeverity()) {
            case CRITICAL, MAJOR -> LOG.error(pattern, args);
            case MODERATE -> LOG.warn(pattern, args);
            default -> LOG.info(pattern, args);
        }
    }
}
