/**
 * Per-component bounded sample history with concurrent writers and
 * snapshot readers.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.buffer;
