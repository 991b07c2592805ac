package com.mapcal.geocal.utilities;

import com.mapcal.geocal.CoordinateCalibrator;
import com.mapcal.geocal.model.AccuracyStatistics;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.PositionTest;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.preferences.CalibrationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Measures how far converted positions land from independently known ones.
 *
 * <p>Each check stores the great-circle distance between the engine's answer and the
 * expected position, plus a 0-100 accuracy score. Only the most recent
 * {@code accuracy.history_size} checks are kept.</p>
 *
 * <p>Accuracy score by distance {@code d} in metres, with thresholds {@code p}, {@code g}
 * and {@code m} (1, 10 and 100 by default):</p>
 * <pre>
 * d ≤ p        100
 * d ≤ g        90 + 10·(g − d)/(g − p)
 * d ≤ m        50 + 40·(m − d)/(m − g)
 * otherwise    max(0, 50 − (d − m)/10)
 * </pre>
 *
 * @since 0.1.0
 */
public class PositionAccuracyMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PositionAccuracyMonitor.class);

    /** Mean Earth radius in metres. */
    static final double EARTH_RADIUS_M = 6371e3;

    private final Deque<PositionTest> tests = new ArrayDeque<>();
    private final int historySize;
    private final int recentWindow;
    private final double perfectThreshold;
    private final double goodThreshold;
    private final double maxDistance;
    private final LongSupplier wallClock;

    public PositionAccuracyMonitor() {
        this(CalibrationSettings.load());
    }

    public PositionAccuracyMonitor(CalibrationSettings settings) {
        this(settings, System::currentTimeMillis);
    }

    public PositionAccuracyMonitor(CalibrationSettings settings, LongSupplier wallClock) {
        Objects.requireNonNull(settings, "settings");
        this.historySize = settings.getHistorySize();
        this.recentWindow = settings.getRecentAccuracyWindow();
        this.perfectThreshold = settings.getPerfectThresholdMeters();
        this.goodThreshold = settings.getGoodThresholdMeters();
        this.maxDistance = settings.getMaxDistanceMeters();
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Converts {@code render} through the calibrator and records the result against
     * {@code expected}.
     *
     * @param calibrator calibrator under test
     * @param render     render position to convert
     * @param expected   known geographic position of {@code render}
     * @return the recorded test
     */
    public PositionTest record(CoordinateCalibrator calibrator, RenderPoint render, GeoPoint expected) {
        GeoPoint calculated = calibrator.toGeographic(render).point();
        return record(render, calculated, expected);
    }

    /**
     * Records one accuracy check.
     *
     * @param render     render position that was converted
     * @param calculated where the engine placed it
     * @param expected   where it actually is
     * @return the recorded test
     */
    public PositionTest record(RenderPoint render, GeoPoint calculated, GeoPoint expected) {
        double distance = haversineDistance(calculated, expected);
        PositionTest test = new PositionTest(
                wallClock.getAsLong(), render, calculated, expected, distance, accuracyScore(distance));

        tests.addLast(test);
        while (tests.size() > historySize) {
            tests.removeFirst();
        }

        logger.debug("Position test at {}: calculated {} expected {} distance {} m accuracy {}%",
                render, calculated, expected, String.format("%.2f", distance), String.format("%.1f", test.accuracy()));
        return test;
    }

    /**
     * Great-circle distance in metres (haversine formula).
     */
    public static double haversineDistance(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.lat());
        double phi2 = Math.toRadians(b.lat());
        double deltaPhi = Math.toRadians(b.lat() - a.lat());
        double deltaLambda = Math.toRadians(b.lon() - a.lon());

        double h = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_M * c;
    }

    /**
     * Accuracy score for a distance, 0 to 100.
     *
     * @param distanceMeters distance between calculated and expected positions
     * @return the score
     */
    public double accuracyScore(double distanceMeters) {
        if (distanceMeters <= perfectThreshold) {
            return 100;
        } else if (distanceMeters <= goodThreshold) {
            return 90 + (10 * (goodThreshold - distanceMeters) / (goodThreshold - perfectThreshold));
        } else if (distanceMeters <= maxDistance) {
            return 50 + (40 * (maxDistance - distanceMeters) / (maxDistance - goodThreshold));
        }
        return Math.max(0, 50 - (distanceMeters - maxDistance) / 10);
    }

    /**
     * @return aggregate over the retained tests
     */
    public AccuracyStatistics statistics() {
        if (tests.isEmpty()) {
            return AccuracyStatistics.EMPTY;
        }

        int n = tests.size();
        double sumDistance = 0, sumAccuracy = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (PositionTest test : tests) {
            sumDistance += test.distanceMeters();
            sumAccuracy += test.accuracy();
            min = Math.min(min, test.distanceMeters());
            max = Math.max(max, test.distanceMeters());
        }
        double avgDistance = sumDistance / n;

        double sumSquaredDiffs = 0;
        for (PositionTest test : tests) {
            double diff = test.distanceMeters() - avgDistance;
            sumSquaredDiffs += diff * diff;
        }

        return new AccuracyStatistics(n, avgDistance, sumAccuracy / n, min, max, Math.sqrt(sumSquaredDiffs / n));
    }

    /**
     * @return mean accuracy of the last {@code accuracy.recent_window} tests, or 0 if none
     */
    public double recentAverageAccuracy() {
        if (tests.isEmpty()) {
            return 0;
        }
        List<PositionTest> all = new ArrayList<>(tests);
        List<PositionTest> recent = all.subList(Math.max(0, all.size() - recentWindow), all.size());
        return recent.stream().mapToDouble(PositionTest::accuracy).average().orElse(0);
    }

    public static String qualityDescription(AccuracyStatistics stats) {
        double accuracy = stats.averageAccuracy();
        if (accuracy >= 90) {
            return "Excellent";
        } else if (accuracy >= 75) {
            return "Good";
        } else if (accuracy >= 60) {
            return "Moderate";
        } else if (accuracy >= 40) {
            return "Poor";
        }
        return "Very Poor";
    }

    public static List<String> recommendations(AccuracyStatistics stats) {
        List<String> recommendations = new ArrayList<>();

        if (stats.averageDistance() > 20) {
            recommendations.add("The coordinate calculation needs significant improvement; add calibration points.");
        }
        if (stats.standardDeviation() > 10) {
            recommendations.add("Position calculations are inconsistent. Check for variable factors affecting calculations.");
        }
        if (stats.maxDistance() > 50) {
            recommendations.add("Extreme outliers detected. Review calibration points for stale or mismatched observations.");
        }

        if (recommendations.isEmpty()) {
            if (stats.averageAccuracy() >= 90) {
                recommendations.add("Current calibration is excellent. No changes needed.");
            } else {
                recommendations.add("Fine-tune the calibration for better precision.");
            }
        }
        return recommendations;
    }

    /**
     * @return a plain-text summary of the retained tests
     */
    public String generateReport() {
        AccuracyStatistics stats = statistics();
        if (stats.totalTests() == 0) {
            return "No position tests have been performed yet.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Position Calibration Report\n");
        sb.append("==========================\n");
        sb.append(String.format("Total tests: %d%n", stats.totalTests()));
        sb.append(String.format("Average distance: %.2fm%n", stats.averageDistance()));
        sb.append(String.format("Average accuracy: %.1f%%%n", stats.averageAccuracy()));
        sb.append(String.format("Min distance: %.2fm%n", stats.minDistance()));
        sb.append(String.format("Max distance: %.2fm%n", stats.maxDistance()));
        sb.append(String.format("Standard deviation: %.2fm%n", stats.standardDeviation()));
        sb.append('\n');
        sb.append("Calibration Quality: ").append(qualityDescription(stats)).append('\n');
        sb.append('\n');
        sb.append("Recommendations:\n");
        for (String recommendation : recommendations(stats)) {
            sb.append("- ").append(recommendation).append('\n');
        }
        return sb.toString();
    }

    /**
     * @return the retained tests, oldest first
     */
    public List<PositionTest> getTests() {
        return Collections.unmodifiableList(new ArrayList<>(tests));
    }

    public void clear() {
        tests.clear();
        logger.info("Position test results cleared");
    }
}
