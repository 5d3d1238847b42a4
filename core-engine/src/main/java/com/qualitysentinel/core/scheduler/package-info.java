/**
 * Single-worker periodic driver for detection cycles.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.scheduler;
