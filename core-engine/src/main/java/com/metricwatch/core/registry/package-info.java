/**
 * Per-pipeline ownership of detector instances.
 *
 * @since 1.0.0
 */
package com.metricwatch.core.registry;
