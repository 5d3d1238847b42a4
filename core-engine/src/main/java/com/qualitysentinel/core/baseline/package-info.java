/**
 * Manual and automatically refreshed baselines.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.baseline;
