package com.qualitysentinel.core.alerting;

import com.qualitysentinel.core.model.RegressionEvent;

/**
 * Receives regressions that pass the alerting policy.
 *
 * <p>
 * Called on the thread that detected the event: the detection worker for
 * periodic methods, a producer thread for arrival checks. Implementations
 * should return quickly.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegressionListener {

    void onRegression(RegressionEvent event);
}
