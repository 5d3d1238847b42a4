/**
 * Micrometer meters for ingestion, detection and cycle latency.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.metrics;
