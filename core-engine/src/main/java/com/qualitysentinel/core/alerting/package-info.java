/**
 * Severity-filtered, rate-limited notification of detected regressions.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.alerting;
