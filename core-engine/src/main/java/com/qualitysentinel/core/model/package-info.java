/**
 * Domain model of the Quality Sentinel engine.
 *
 * <p>
 * All model types are immutable once built:
 * </p>
 * <ul>
 * <li>{@link com.qualitysentinel.core.model.MonitoredMetric}: registration of one
 * {@code (component, metric)} pair</li>
 * <li>{@link com.qualitysentinel.core.model.MetricSample}: one recorded value</li>
 * <li>{@link com.qualitysentinel.core.model.Baseline}: reference value with a
 * confidence interval</li>
 * <li>{@link com.qualitysentinel.core.model.RegressionEvent}: a detected
 * regression</li>
 * <li>{@link com.qualitysentinel.core.model.RegressionReport}: aggregate over a
 * time period</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.model;
