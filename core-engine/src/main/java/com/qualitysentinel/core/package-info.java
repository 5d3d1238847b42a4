/**
 * Quality regression detection engine.
 *
 * <p>
 * {@link com.qualitysentinel.core.RegressionEngine} is the facade; the
 * sub-packages hold its parts.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core;
