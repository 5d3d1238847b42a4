package com.qualitysentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Severity tier boundaries, expressed as absolute change percentages.
 *
 * <pre>
 * severity:
 *   minor: 5.0
 *   moderate: 15.0
 *   major: 30.0
 *   critical: 50.0
 * </pre>
 *
 * @since 1.0.0
 */
public class SeveritySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double minor = 5.0;
    private double moderate = 15.0;
    private double major = 30.0;
    private double critical = 50.0;

    void validate(List<String> errors) {
        if (minor < 0) {
            errors.add("severity.minor must be >= 0, got: " + minor);
        }
        if (!(minor < moderate && moderate < major && major < critical)) {
            errors.add("severity boundaries must be strictly ascending (minor < moderate < major < critical), got: "
                    + minor + ", " + moderate + ", " + major + ", " + critical);
        }
    }

    public double getMinor() {
        return minor;
    }

    public void setMinor(double minor) {
        this.minor = minor;
    }

    public double getModerate() {
        return moderate;
    }

    public void setModerate(double moderate) {
        this.moderate = moderate;
    }

    public double getMajor() {
        return major;
    }

    public void setMajor(double major) {
        this.major = major;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    @Override
    public String toString() {
        return "SeveritySettings{minor=" + minor + ", moderate=" + moderate
                + ", major=" + major + ", critical=" + critical + '}';
    }
}
