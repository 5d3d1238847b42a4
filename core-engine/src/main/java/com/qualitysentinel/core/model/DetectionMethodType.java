package com.qualitysentinel.core.model;

import java.util.Locale;

/**
 * The detection algorithm that produced a regression event.
 *
 * @since 1.0.0
 */
public enum DetectionMethodType {
    THRESHOLD,
    STATISTICAL,
    TREND,
    CHANGE_POINT,
    ANOMALY;

    /** @return lowercase wire name, e.g. {@code change_point} */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
