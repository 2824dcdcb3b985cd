package com.metricwatch.pipeline;

import com.metricwatch.core.model.DataPoint;

import java.io.IOException;
import java.util.List;

/**
 * Long-term destination for flushed data points.
 *
 * <p>
 * Called from the pipeline's flush thread with batches in ingestion order.
 * A failure leaves the batch pending; the same points are offered again on
 * the next flush, so implementations should tolerate seeing a point twice.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricStorage {

    /**
     * Persist a batch.
     *
     * @param batch points in ingestion order; never empty
     * @throws IOException if the batch could not be stored
     */
    void store(List<DataPoint> batch) throws IOException;
}
