package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Optional static {@code lower}/{@code upper} bounds for a metric.
 *
 * <p>
 * Either bound may be {@code null}, meaning that side is unbounded.
 * </p>
 *
 * @since 1.0.0
 */
public final class Thresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Thresholds NONE = new Thresholds(null, null);

    private final Double lower;
    private final Double upper;

    private Thresholds(Double lower, Double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /** @return thresholds with neither bound set */
    public static Thresholds none() {
        return NONE;
    }

    /**
     * @param lower lower bound, or {@code null}
     * @param upper upper bound, or {@code null}
     * @return the thresholds
     * @throws IllegalArgumentException if both bounds are set and {@code lower > upper},
     *                                  or a bound is not finite
     */
    public static Thresholds of(Double lower, Double upper) {
        if (lower != null && !Double.isFinite(lower)) {
            throw new IllegalArgumentException("lower threshold must be finite, got: " + lower);
        }
        if (upper != null && !Double.isFinite(upper)) {
            throw new IllegalArgumentException("upper threshold must be finite, got: " + upper);
        }
        if (lower != null && upper != null && lower > upper) {
            throw new IllegalArgumentException(
                    "lower threshold " + lower + " must not exceed upper threshold " + upper);
        }
        if (lower == null && upper == null) {
            return NONE;
        }
        return new Thresholds(lower, upper);
    }

    /** @return the lower bound, or {@code null} if unbounded below */
    public Double getLower() {
        return lower;
    }

    /** @return the upper bound, or {@code null} if unbounded above */
    public Double getUpper() {
        return upper;
    }

    public boolean isEmpty() {
        return lower == null && upper == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Thresholds that))
            return false;
        return Objects.equals(lower, that.lower) && Objects.equals(upper, that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return "Thresholds{lower=" + lower + ", upper=" + upper + '}';
    }
}
