package com.mapcal.geocal;

import com.mapcal.geocal.model.CalibrationStatus;
import com.mapcal.geocal.model.CorrespondencePoint;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.Projection;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.model.TransformParameters;
import com.mapcal.geocal.preferences.CalibrationSettings;
import com.mapcal.geocal.service.InverseUndefinedException;
import com.mapcal.geocal.service.MapProvider;
import com.mapcal.geocal.service.RenderHost;
import com.mapcal.geocal.utilities.CalibrationReport;
import com.mapcal.geocal.utilities.CalibrationStore;
import com.mapcal.geocal.utilities.CoordinateMapper;
import com.mapcal.geocal.utilities.FallbackProjector;
import com.mapcal.geocal.utilities.TransformEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Calibrates render space against geographic space and converts positions in both
 * directions.
 *
 * <p>Callers register correspondence points whenever a render position and its true
 * geographic position are known at the same moment. Once at least
 * {@code calibration.minimum_points} exist, every new point triggers a full recompute of
 * the transform, and conversions use it. Until then, conversions go through the
 * {@link FallbackProjector}.</p>
 *
 * <p>Each instance owns its own points and parameters, so independent calibration contexts
 * can coexist. Instances are not thread-safe: all calls are expected from the host's single
 * update context. A multi-threaded host must synchronize externally.</p>
 *
 * <pre>{@code
 * CoordinateCalibrator calibrator = new CoordinateCalibrator(mapProvider, renderHost);
 * calibrator.addPoint(playerX, playerY, confirmedLat, confirmedLon);
 * GeoPoint where = calibrator.toGeographic(playerX, playerY);
 * }</pre>
 *
 * @since 0.1.0
 */
public class CoordinateCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateCalibrator.class);

    private final CalibrationStore store;
    private final TransformEstimator estimator;
    private final CoordinateMapper mapper;
    private final FallbackProjector fallback;
    private final int minimumPoints;

    private TransformParameters parameters = TransformParameters.DEFAULTS;

    public CoordinateCalibrator(MapProvider mapProvider, RenderHost renderHost) {
        this(mapProvider, renderHost, CalibrationSettings.load());
    }

    public CoordinateCalibrator(MapProvider mapProvider, RenderHost renderHost, CalibrationSettings settings) {
        this(new CalibrationStore(), new TransformEstimator(settings), new CoordinateMapper(),
                new FallbackProjector(mapProvider, renderHost), settings);
    }

    CoordinateCalibrator(CalibrationStore store,
                         TransformEstimator estimator,
                         CoordinateMapper mapper,
                         FallbackProjector fallback,
                         CalibrationSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.minimumPoints = Objects.requireNonNull(settings, "settings").getMinimumPoints();
    }

    /**
     * Adds a calibration point with known render and geographic coordinates.
     *
     * @param renderX render x
     * @param renderY render y
     * @param geoLat  latitude in degrees
     * @param geoLon  longitude in degrees
     */
    public void addPoint(double renderX, double renderY, double geoLat, double geoLon) {
        addPoint(new RenderPoint(renderX, renderY), new GeoPoint(geoLat, geoLon));
    }

    /**
     * Adds a calibration point and recomputes the transform if enough points now exist.
     *
     * @param render observed render position
     * @param geo    observed geographic position
     */
    public void addPoint(RenderPoint render, GeoPoint geo) {
        Objects.requireNonNull(render, "render");
        Objects.requireNonNull(geo, "geo");

        store.addPoint(render, geo);
        logger.info("Added calibration point #{}: render {} -> geo {}", store.size(), render, geo);

        if (store.size() >= minimumPoints) {
            parameters = estimator.recompute(store.getPoints(), parameters);
        }
    }

    /**
     * Discards all points and resets the transform to defaults. Calling it again has no
     * further effect.
     */
    public void clear() {
        store.clear();
        parameters = TransformParameters.DEFAULTS;
        logger.info("Calibration data cleared");
    }

    public boolean isCalibrated() {
        return store.size() >= minimumPoints;
    }

    /**
     * @return snapshot of point count, calibration state and parameters
     */
    public CalibrationStatus status() {
        return new CalibrationStatus(store.size(), isCalibrated(), parameters);
    }

    public TransformParameters getParameters() {
        return parameters;
    }

    /**
     * @return the stored points in insertion order
     */
    public List<CorrespondencePoint> getPoints() {
        return store.getPoints();
    }

    /**
     * Render to geographic, through the fitted transform when calibrated and the fallback
     * projector otherwise.
     *
     * @param render render position
     * @return the geographic position and how it was obtained
     */
    public Projection<GeoPoint> toGeographic(RenderPoint render) {
        Objects.requireNonNull(render, "render");
        if (!isCalibrated()) {
            return fallback.toGeographic(render);
        }
        return Projection.calibrated(mapper.toGeographic(render, parameters));
    }

    /**
     * @see #toGeographic(RenderPoint)
     */
    public GeoPoint toGeographic(double renderX, double renderY) {
        return toGeographic(new RenderPoint(renderX, renderY)).point();
    }

    /**
     * Geographic to render, through the inverse of the fitted transform when calibrated and
     * the fallback projector otherwise.
     *
     * @param geo geographic position
     * @return the render position and how it was obtained
     * @throws InverseUndefinedException if calibrated with a zero scale factor
     */
    public Projection<RenderPoint> toRender(GeoPoint geo) {
        Objects.requireNonNull(geo, "geo");
        if (!isCalibrated()) {
            return fallback.toRender(geo);
        }
        return Projection.calibrated(mapper.toRender(geo, parameters));
    }

    /**
     * @see #toRender(GeoPoint)
     */
    public RenderPoint toRender(double geoLat, double geoLon) {
        return toRender(new GeoPoint(geoLat, geoLon)).point();
    }

    /**
     * The current forward mapping as a matrix taking render {@code (x, y)} to
     * {@code (lon, lat)}, for hosts that transform their own geometry.
     *
     * @return a new transform; identity-like (unit scale) while uncalibrated
     */
    public AffineTransform currentTransform() {
        return mapper.toAffineTransform(parameters);
    }

    /**
     * Root mean square distance, in degrees, between each stored point's observed
     * geographic position and where the current transform places its render position.
     *
     * @return the residual, or empty if not calibrated
     */
    public OptionalDouble residualError() {
        if (!isCalibrated()) {
            return OptionalDouble.empty();
        }

        double sumSqError = 0;
        List<CorrespondencePoint> points = store.getPoints();
        for (CorrespondencePoint point : points) {
            GeoPoint predicted = mapper.toGeographic(point.render(), parameters);
            double dLat = point.geoLat() - predicted.lat();
            double dLon = point.geoLon() - predicted.lon();
            sumSqError += dLat * dLat + dLon * dLon;
        }
        return OptionalDouble.of(Math.sqrt(sumSqError / points.size()));
    }

    /**
     * Logs the current parameters as a JSON snapshot.
     */
    public void logCalibration() {
        if (!isCalibrated()) {
            logger.warn("Not enough calibration points to apply calibration ({} of {})",
                    store.size(), minimumPoints);
            return;
        }
        logger.info("Current calibration parameters:\n{}", CalibrationReport.toJson(status(), residualError()));
    }
}
