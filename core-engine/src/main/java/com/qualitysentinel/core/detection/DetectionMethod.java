package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.DetectionMethodType;

import java.util.Optional;

/**
 * Contract for all regression detection methods.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: everything a method needs
 * is carried by the {@link DetectionContext}, so one instance serves every
 * metric and may be called from the detection worker and from producer
 * threads at the same time.
 * </p>
 * <p>
 * A method that lacks data, or whose statistics are degenerate (zero
 * deviation, zero baseline), abstains by returning empty. It never returns a
 * candidate with a non-finite score.
 * </p>
 *
 * @since 1.0.0
 */
public interface DetectionMethod {

    /**
     * Evaluate one metric's window and decide whether it has regressed.
     *
     * @param context the metric, its sample window and its current baseline
     * @return a {@link Detection} if the method fires, empty otherwise
     */
    Optional<Detection> evaluate(DetectionContext context);

    /**
     * @return the method this implementation represents
     */
    DetectionMethodType type();

    /**
     * Whether this method runs as each sample arrives rather than on the
     * periodic cycle.
     *
     * @return {@code true} for arrival methods
     */
    default boolean onArrival() {
        return false;
    }
}
