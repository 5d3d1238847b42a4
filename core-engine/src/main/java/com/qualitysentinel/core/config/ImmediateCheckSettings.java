package com.qualitysentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Deviation check run against the baseline as soon as a sample arrives.
 * Only MAJOR and CRITICAL deviations produce an event.
 *
 * @since 1.0.0
 */
public class ImmediateCheckSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;
    /** Absolute change percentage a single sample must exceed. */
    private double changePercent = 25.0;

    void validate(List<String> errors) {
        if (changePercent <= 0) {
            errors.add("immediateCheck.changePercent must be > 0, got: " + changePercent);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public void setChangePercent(double changePercent) {
        this.changePercent = changePercent;
    }

    @Override
    public String toString() {
        return "ImmediateCheckSettings{enabled=" + enabled + ", changePercent=" + changePercent + '}';
    }
}
