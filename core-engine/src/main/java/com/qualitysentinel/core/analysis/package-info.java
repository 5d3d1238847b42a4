/**
 * Severity classification, root-cause heuristics and shared statistics.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.analysis;
