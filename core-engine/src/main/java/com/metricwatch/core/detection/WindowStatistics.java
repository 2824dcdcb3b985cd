package com.metricwatch.core.detection;

import java.util.Collection;

/**
 * Population statistics helpers shared by the z-score detectors.
 */
final class WindowStatistics {

    private WindowStatistics() {
        // utility class - not instantiable
    }

    static double mean(Collection<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population (not sample-corrected) standard deviation. */
    static double stdDev(Collection<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    static double stdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }
}
