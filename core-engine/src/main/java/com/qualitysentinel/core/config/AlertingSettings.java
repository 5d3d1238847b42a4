package com.qualitysentinel.core.config;

import com.qualitysentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Which events are pushed to listeners, and how often.
 *
 * <pre>
 * alerting:
 *   enabled: true
 *   alertOnSeverity: [major, critical]
 *   cooldownSeconds: 1800
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;
    private List<String> alertOnSeverity = new ArrayList<>(List.of("major", "critical"));
    private long cooldownSeconds = 1_800;

    void validate(List<String> errors) {
        for (String name : alertOnSeverity) {
            try {
                Severity.parse(name);
            } catch (IllegalArgumentException e) {
                errors.add("alerting.alertOnSeverity contains unknown severity: '" + name + "'");
            }
        }
        if (cooldownSeconds < 0) {
            errors.add("alerting.cooldownSeconds must be >= 0, got: " + cooldownSeconds);
        }
    }

    /** @return parsed alerting severities; call after validation */
    public Set<Severity> alertSeverities() {
        Set<Severity> severities = EnumSet.noneOf(Severity.class);
        for (String name : alertOnSeverity) {
            severities.add(Severity.parse(name));
        }
        return severities;
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getAlertOnSeverity() {
        return alertOnSeverity;
    }

    public void setAlertOnSeverity(List<String> alertOnSeverity) {
        this.alertOnSeverity = alertOnSeverity != null ? new ArrayList<>(alertOnSeverity) : new ArrayList<>();
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    @Override
    public String toString() {
        return "AlertingSettings{enabled=" + enabled + ", alertOnSeverity=" + alertOnSeverity
                + ", cooldownSeconds=" + cooldownSeconds + '}';
    }
}
