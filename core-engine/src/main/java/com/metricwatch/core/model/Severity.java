package com.metricwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity tier attached to every {@link DetectionResult}.
 *
 * <p>
 * Tiers are ordered: {@code LOW < MEDIUM < HIGH < CRITICAL}, so
 * {@link #compareTo(Enum)} can be used by alerting code to filter results.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** z-score above which a result is {@link #MEDIUM}. */
    public static final double MEDIUM_Z = 2.5;

    /** z-score above which a result is {@link #HIGH}. */
    public static final double HIGH_Z = 3.0;

    /** z-score above which a result is {@link #CRITICAL}. */
    public static final double CRITICAL_Z = 3.5;

    /**
     * Classify a z-score using the default tier boundaries.
     *
     * @param zScore absolute z-score
     * @return the matching tier
     */
    public static Severity fromZScore(double zScore) {
        return fromZScore(zScore, MEDIUM_Z, HIGH_Z, CRITICAL_Z);
    }

    /**
     * Classify a z-score against explicit tier boundaries. Each boundary is
     * exclusive: a z-score equal to {@code high} is {@link #MEDIUM}.
     *
     * @param zScore   absolute z-score
     * @param medium   lower bound for {@link #MEDIUM}
     * @param high     lower bound for {@link #HIGH}
     * @param critical lower bound for {@link #CRITICAL}
     * @return the matching tier
     */
    public static Severity fromZScore(double zScore, double medium, double high, double critical) {
        if (zScore > critical) {
            return CRITICAL;
        }
        if (zScore > high) {
            return HIGH;
        }
        if (zScore > medium) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Classify a normalized model score in [0, 1].
     *
     * @param score anomaly confidence
     * @return {@code CRITICAL} above 0.9, {@code HIGH} above 0.8,
     *         {@code MEDIUM} above 0.7, otherwise {@code LOW}
     */
    public static Severity fromScore(double score) {
        if (score > 0.9) {
            return CRITICAL;
        }
        if (score > 0.8) {
            return HIGH;
        }
        if (score > 0.7) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromJson(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
