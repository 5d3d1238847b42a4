/**
 * Registry of monitored {@code (component, metric)} pairs.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.registry;
