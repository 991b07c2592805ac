package com.mapcal.geocal.model;

/**
 * Aggregate over the retained position tests. All fields are zero when no tests exist.
 *
 * @since 0.1.0
 */
public record AccuracyStatistics(
        int totalTests,
        double averageDistance,
        double averageAccuracy,
        double minDistance,
        double maxDistance,
        double standardDeviation) {

    public static final AccuracyStatistics EMPTY = new AccuracyStatistics(0, 0, 0, 0, 0, 0);
}
