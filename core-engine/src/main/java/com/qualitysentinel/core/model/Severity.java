package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * Severity tier of a regression, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    MINOR,
    MODERATE,
    MAJOR,
    CRITICAL;

    /**
     * Parse a severity name, case-insensitively.
     *
     * @param value severity name, e.g. {@code "major"}
     * @return the matching severity
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /** @return lowercase wire name */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
