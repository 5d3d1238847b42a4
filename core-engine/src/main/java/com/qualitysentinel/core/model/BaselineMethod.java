package com.qualitysentinel.core.model;

/**
 * How a {@link Baseline} was obtained.
 *
 * @since 1.0.0
 */
public enum BaselineMethod {
    /** Supplied by the caller at registration time. */
    MANUAL,
    /** Recomputed from a stable window of recent samples. */
    AUTOMATIC
}
