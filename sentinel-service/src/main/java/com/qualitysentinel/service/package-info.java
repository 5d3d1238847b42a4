/**
 * Standalone service process around the core regression engine.
 *
 * <p>
 * Exposes sample ingestion, metric registration, event queries and reports
 * over HTTP/JSON, and forwards alerts as JSON log lines.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.qualitysentinel.service.QualitySentinelService}: main entry
 * point</li>
 * <li>{@link com.qualitysentinel.service.ServiceConfig}: environment-driven
 * process configuration</li>
 * <li>{@link com.qualitysentinel.service.SentinelHttpServer}: HTTP
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.service;
