/**
 * Event storage, querying and period reports.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.events;
