/**
 * Pluggable regression detection methods and the engine that runs them.
 *
 * <p>
 * Each method implements {@link com.qualitysentinel.core.detection.DetectionMethod};
 * {@link com.qualitysentinel.core.detection.DetectionMethodFactory} builds the
 * enabled set from configuration.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.detection;
