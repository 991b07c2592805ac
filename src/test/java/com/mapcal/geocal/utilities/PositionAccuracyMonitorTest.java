package com.mapcal.geocal.utilities;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.mapcal.geocal.CoordinateCalibrator;
import com.mapcal.geocal.model.AccuracyStatistics;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.PositionTest;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.preferences.CalibrationSettings;
import com.mapcal.geocal.service.MapProvider;
import com.mapcal.geocal.service.RenderHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

/**
 * Unit tests for PositionAccuracyMonitor.
 */
class PositionAccuracyMonitorTest {

    private static final RenderPoint ANY_RENDER = new RenderPoint(0, 0);

    private PositionAccuracyMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new PositionAccuracyMonitor(CalibrationSettings.load(), () -> 42L);
    }

    @Test
    @DisplayName("One degree of latitude is about 111.19 km")
    void testHaversineOneDegree() {
        double d = PositionAccuracyMonitor.haversineDistance(new GeoPoint(0, 0), new GeoPoint(1, 0));
        assertEquals(111_194.93, d, 0.01);
    }

    @Test
    void testHaversineSamePointIsZero() {
        GeoPoint p = new GeoPoint(51.5, -0.12);
        assertEquals(0.0, PositionAccuracyMonitor.haversineDistance(p, p), 1e-9);
    }

    @ParameterizedTest(name = "{0} m -> {1}")
    @CsvSource({
            "0,     100",
            "1,     100",
            "5.5,   95",
            "10,    90",
            "55,    70",
            "100,   50",
            "300,   30",
            "1000,  0"
    })
    @DisplayName("Accuracy score follows the piecewise distance thresholds")
    void testAccuracyScore(double distance, double expected) {
        assertEquals(expected, monitor.accuracyScore(distance), 1e-9);
    }

    @Test
    @DisplayName("Statistics over two tests")
    void testStatistics() {
        GeoPoint expected = new GeoPoint(10, 10);
        GeoPoint off = new GeoPoint(10.0001, 10);
        double d = PositionAccuracyMonitor.haversineDistance(off, expected);

        monitor.record(ANY_RENDER, expected, expected);
        PositionTest second = monitor.record(ANY_RENDER, off, expected);

        AccuracyStatistics stats = monitor.statistics();
        assertEquals(2, stats.totalTests());
        assertEquals(d / 2, stats.averageDistance(), 1e-9);
        assertEquals(0.0, stats.minDistance(), 1e-12);
        assertEquals(d, stats.maxDistance(), 1e-9);
        assertEquals(d / 2, stats.standardDeviation(), 1e-9);
        assertEquals((100 + second.accuracy()) / 2, stats.averageAccuracy(), 1e-9);
        assertEquals(42L, second.timestampMillis());
    }

    @Test
    void testEmptyStatistics() {
        assertEquals(AccuracyStatistics.EMPTY, monitor.statistics());
        assertEquals(0.0, monitor.recentAverageAccuracy());
        assertEquals("No position tests have been performed yet.", monitor.generateReport());
    }

    @Test
    @DisplayName("History keeps only the newest tests")
    void testHistoryBounded() {
        PositionAccuracyMonitor small = new PositionAccuracyMonitor(
                CalibrationSettings.fromMap(Map.of("accuracy", Map.of("history_size", 3))));

        for (int i = 0; i < 5; i++) {
            small.record(new RenderPoint(i, i), new GeoPoint(0, 0), new GeoPoint(0, 0));
        }

        assertEquals(3, small.getTests().size());
        assertEquals(new RenderPoint(2, 2), small.getTests().get(0).render());
        assertEquals(new RenderPoint(4, 4), small.getTests().get(2).render());
    }

    @Test
    @DisplayName("Recent average only looks at the last ten tests")
    void testRecentAverageAccuracy() {
        GeoPoint expected = new GeoPoint(0, 0);
        // Far miss (about 111 km) scores 0
        monitor.record(ANY_RENDER, new GeoPoint(1, 0), expected);
        for (int i = 0; i < 10; i++) {
            monitor.record(ANY_RENDER, expected, expected);
        }

        assertEquals(100.0, monitor.recentAverageAccuracy(), 1e-9);
        assertTrue(monitor.statistics().averageAccuracy() < 100.0);
    }

    @Test
    void testQualityDescriptions() {
        assertEquals("Excellent", PositionAccuracyMonitor.qualityDescription(stats(95, 0, 0, 0)));
        assertEquals("Good", PositionAccuracyMonitor.qualityDescription(stats(80, 0, 0, 0)));
        assertEquals("Moderate", PositionAccuracyMonitor.qualityDescription(stats(60, 0, 0, 0)));
        assertEquals("Poor", PositionAccuracyMonitor.qualityDescription(stats(45, 0, 0, 0)));
        assertEquals("Very Poor", PositionAccuracyMonitor.qualityDescription(stats(10, 0, 0, 0)));
    }

    @Test
    void testRecommendations() {
        assertEquals(1, PositionAccuracyMonitor.recommendations(stats(95, 0.5, 0, 1)).size());
        assertTrue(PositionAccuracyMonitor.recommendations(stats(95, 0.5, 0, 1)).get(0).contains("excellent"));
        assertTrue(PositionAccuracyMonitor.recommendations(stats(85, 5, 1, 8)).get(0).startsWith("Fine-tune"));
        assertEquals(3, PositionAccuracyMonitor.recommendations(stats(20, 30, 15, 80)).size());
    }

    @Test
    @DisplayName("Report includes the quality line and recommendations")
    void testGenerateReport() {
        monitor.record(ANY_RENDER, new GeoPoint(1, 1), new GeoPoint(1, 1));

        String report = monitor.generateReport();

        assertTrue(report.startsWith("Position Calibration Report"));
        assertTrue(report.contains("Total tests: 1"));
        assertTrue(report.contains("Calibration Quality: Excellent"));
        assertTrue(report.contains("- Current calibration is excellent. No changes needed."));
    }

    @Test
    @DisplayName("Recording through a calibrator uses its conversion")
    void testRecordThroughCalibrator() {
        CoordinateCalibrator calibrator = new CoordinateCalibrator(mock(MapProvider.class), mock(RenderHost.class));
        calibrator.addPoint(0, 0, 0, 0);
        calibrator.addPoint(100, 0, 0, 1);
        calibrator.addPoint(0, 100, 1, 0);

        PositionTest test = monitor.record(calibrator, new RenderPoint(50, 50), new GeoPoint(0.5, 0.5));

        assertEquals(0.5, test.calculated().lat(), 1e-12);
        assertEquals(0.5, test.calculated().lon(), 1e-12);
        assertEquals(100.0, test.accuracy());
    }

    @Test
    void testClear() {
        monitor.record(ANY_RENDER, new GeoPoint(0, 0), new GeoPoint(0, 0));
        monitor.clear();
        assertTrue(monitor.getTests().isEmpty());
    }

    private static AccuracyStatistics stats(double avgAccuracy, double avgDistance, double stdDev, double maxDistance) {
        return new AccuracyStatistics(1, avgDistance, avgAccuracy, 0, maxDistance, stdDev);
    }
}
