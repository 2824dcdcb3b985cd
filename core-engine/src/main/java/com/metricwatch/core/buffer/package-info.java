/**
 * Bounded in-memory storage for recently ingested metric samples.
 *
 * @since 1.0.0
 */
package com.metricwatch.core.buffer;
