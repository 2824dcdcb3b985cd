package com.metricwatch.pipeline;

import com.metricwatch.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricStorage} that only logs what it receives. Used when no
 * time-series store is wired in.
 */
public class LoggingMetricStorage implements MetricStorage {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingMetricStorage.class);

    private final AtomicLong stored = new AtomicLong();

    @Override
    public void store(List<DataPoint> batch) {
        long total = stored.addAndGet(batch.size());
        LOG.info("Flushed {} point(s) ({} total); last: {}", batch.size(), total, batch.get(batch.size() - 1));
    }
}
