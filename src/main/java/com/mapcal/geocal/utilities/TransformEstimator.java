package com.mapcal.geocal.utilities;

import com.mapcal.geocal.model.CorrespondencePoint;
import com.mapcal.geocal.model.TransformParameters;
import com.mapcal.geocal.preferences.CalibrationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Derives {@link TransformParameters} from the most recent correspondence points.
 *
 * <p>Model: {@code lon = x'·scaleX + offsetX}, {@code lat = y'·scaleY + offsetY}, where
 * {@code (x', y')} is the render point rotated by {@code rotationRadians}.</p>
 *
 * <p>This is a bounding-box fit, not a least-squares similarity fit:</p>
 * <ul>
 *   <li>Only the newest {@code recent_point_window} points are used (10 by default).</li>
 *   <li>Scale per axis is geographic span over render span of those points.</li>
 *   <li>Offsets align the means of the two point clouds.</li>
 *   <li>Rotation, once {@code rotation_minimum_points} are selected, is the angle between
 *       the newest-to-second-newest vector in geographic space (lon as x, lat as y) and the
 *       same vector in render space. It depends on which two points are newest.</li>
 * </ul>
 *
 * <p>The estimator holds no state; every call recomputes the parameters in full.</p>
 *
 * @since 0.1.0
 */
public class TransformEstimator {
    private static final Logger logger = LoggerFactory.getLogger(TransformEstimator.class);

    private final int minimumPoints;
    private final int recentPointWindow;
    private final int rotationMinimumPoints;

    public TransformEstimator() {
        this(CalibrationSettings.load());
    }

    public TransformEstimator(CalibrationSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.minimumPoints = settings.getMinimumPoints();
        this.recentPointWindow = settings.getRecentPointWindow();
        this.rotationMinimumPoints = settings.getRotationMinimumPoints();
    }

    /**
     * Recomputes from scratch, treating the defaults as the previous parameters.
     *
     * @param points all stored points, any order
     * @return fitted parameters, or the defaults if there are too few points
     */
    public TransformParameters recompute(List<CorrespondencePoint> points) {
        return recompute(points, TransformParameters.DEFAULTS);
    }

    /**
     * Fits new parameters to the most recent points.
     *
     * @param points   all stored points, any order; the list is not modified
     * @param previous parameters in effect before this call; returned unchanged when there are
     *                 too few points, and the source of a scale factor whose render span is zero
     * @return the fitted parameters
     */
    public TransformParameters recompute(List<CorrespondencePoint> points, TransformParameters previous) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(previous, "previous");

        if (points.size() < minimumPoints) {
            logger.warn("Need at least {} calibration points to recompute, have {}", minimumPoints, points.size());
            return previous;
        }

        List<CorrespondencePoint> selected = selectMostRecent(points, recentPointWindow);
        int n = selected.size();

        double sumRenderX = 0, sumRenderY = 0, sumLat = 0, sumLon = 0;
        double minRenderX = Double.POSITIVE_INFINITY, maxRenderX = Double.NEGATIVE_INFINITY;
        double minRenderY = Double.POSITIVE_INFINITY, maxRenderY = Double.NEGATIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY, maxLat = Double.NEGATIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY, maxLon = Double.NEGATIVE_INFINITY;

        for (CorrespondencePoint p : selected) {
            sumRenderX += p.renderX();
            sumRenderY += p.renderY();
            sumLat += p.geoLat();
            sumLon += p.geoLon();

            minRenderX = Math.min(minRenderX, p.renderX());
            maxRenderX = Math.max(maxRenderX, p.renderX());
            minRenderY = Math.min(minRenderY, p.renderY());
            maxRenderY = Math.max(maxRenderY, p.renderY());
            minLat = Math.min(minLat, p.geoLat());
            maxLat = Math.max(maxLat, p.geoLat());
            minLon = Math.min(minLon, p.geoLon());
            maxLon = Math.max(maxLon, p.geoLon());
        }

        double meanRenderX = sumRenderX / n;
        double meanRenderY = sumRenderY / n;
        double meanLat = sumLat / n;
        double meanLon = sumLon / n;

        double renderXSpan = maxRenderX - minRenderX;
        double renderYSpan = maxRenderY - minRenderY;
        double latSpan = maxLat - minLat;
        double lonSpan = maxLon - minLon;

        double scaleX = axisScale("x", lonSpan, renderXSpan, previous.scaleX());
        double scaleY = axisScale("y", latSpan, renderYSpan, previous.scaleY());

        double offsetX = meanLon - meanRenderX * scaleX;
        double offsetY = meanLat - meanRenderY * scaleY;

        double rotation = 0.0;
        if (n >= rotationMinimumPoints) {
            rotation = estimateRotation(selected.get(0), selected.get(1));
        }

        TransformParameters result = new TransformParameters(scaleX, scaleY, offsetX, offsetY, rotation);
        logger.info("Calibration parameters calculated from {} of {} points: {}", n, points.size(), result);
        return result;
    }

    /**
     * Newest first by insertion sequence, at most {@code limit} points.
     */
    static List<CorrespondencePoint> selectMostRecent(List<CorrespondencePoint> points, int limit) {
        return points.stream()
                .sorted(CorrespondencePoint.MOST_RECENT_FIRST)
                .limit(limit)
                .toList();
    }

    private static double axisScale(String axis, double geoSpan, double renderSpan, double previousScale) {
        if (renderSpan == 0.0) {
            logger.warn("Render {} span is zero across the selected points; keeping previous scale {}",
                    axis, previousScale);
            return previousScale;
        }
        double scale = geoSpan / renderSpan;
        if (scale == 0.0) {
            logger.warn("Geographic span along render {} is zero; scale is 0 and the inverse transform is undefined",
                    axis);
        }
        return scale;
    }

    private static double estimateRotation(CorrespondencePoint newest, CorrespondencePoint secondNewest) {
        double renderDx = secondNewest.renderX() - newest.renderX();
        double renderDy = secondNewest.renderY() - newest.renderY();
        double geoDx = secondNewest.geoLon() - newest.geoLon();
        double geoDy = secondNewest.geoLat() - newest.geoLat();

        double renderAngle = Math.atan2(renderDy, renderDx);
        double geoAngle = Math.atan2(geoDy, geoDx);

        logger.debug("Rotation from vectors render ({}, {}) and geo ({}, {})", renderDx, renderDy, geoDx, geoDy);
        return geoAngle - renderAngle;
    }
}
