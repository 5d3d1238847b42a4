package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Kind of quality a monitored metric represents. Drives the root-cause and
 * recommendation tables.
 *
 * @since 1.0.0
 */
public enum RegressionCategory {
    PERFORMANCE,
    ACCURACY,
    RELIABILITY,
    EFFICIENCY,
    QUALITY,
    STABILITY;

    /**
     * Parse a category name, case-insensitively.
     *
     * @param value category name, e.g. {@code "performance"}
     * @return the matching category
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RegressionCategory parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Regression category must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** @return lowercase wire name */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
