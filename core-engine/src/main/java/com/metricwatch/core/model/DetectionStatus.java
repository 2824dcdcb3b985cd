package com.metricwatch.core.model;

/**
 * Whether a detector actually evaluated a value or is still warming up.
 *
 * @since 1.0.0
 */
public enum DetectionStatus {

    /** Too few observations; the result is never anomalous. */
    COLLECTING_BASELINE,

    /** The value was scored against an established baseline or model. */
    EVALUATED
}
