package com.mapcal.geocal.model;

/**
 * How a converted coordinate was obtained, from most to least trustworthy.
 *
 * @since 0.1.0
 */
public enum ProjectionMethod {
    /** Fitted transform from three or more correspondence points. */
    CALIBRATED,
    /** The map provider's own conversion routine. */
    PROVIDER,
    /** Linear degrees-per-pixel estimate around the viewport center. */
    LINEAR_ESTIMATE,
    /** No usable viewport information; the value is a placeholder, not a position. */
    DEGRADED
}
