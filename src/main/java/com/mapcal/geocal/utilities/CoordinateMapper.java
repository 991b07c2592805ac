package com.mapcal.geocal.utilities;

import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.model.TransformParameters;
import com.mapcal.geocal.service.InverseUndefinedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;

/**
 * Applies fitted {@link TransformParameters} in either direction.
 *
 * <p>Coordinate Systems:
 * <ul>
 *   <li><b>Render:</b> viewport pixels, y down</li>
 *   <li><b>Geographic:</b> degrees, longitude as the x-analog and latitude as the y-analog</li>
 * </ul>
 *
 * <p>Transform Chain:
 * <pre>
 * Render ←→ Rotated render ←→ Geographic
 *        (θ)              (scale, offset)
 * </pre>
 *
 * <p>The mapper holds no state. {@link #toRender} is the exact algebraic inverse of
 * {@link #toGeographic}, so a round trip returns the original point up to rounding.</p>
 *
 * @since 0.1.0
 */
public class CoordinateMapper {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateMapper.class);

    /**
     * Render to geographic.
     *
     * @param render     render position
     * @param parameters fitted parameters
     * @return geographic position
     */
    public GeoPoint toGeographic(RenderPoint render, TransformParameters parameters) {
        double x = render.x();
        double y = render.y();

        double theta = parameters.rotationRadians();
        if (theta != 0.0) {
            double cos = Math.cos(theta);
            double sin = Math.sin(theta);
            double rotatedX = x * cos - y * sin;
            double rotatedY = x * sin + y * cos;
            x = rotatedX;
            y = rotatedY;
        }

        double lon = x * parameters.scaleX() + parameters.offsetX();
        double lat = y * parameters.scaleY() + parameters.offsetY();

        GeoPoint geo = new GeoPoint(lat, lon);
        logger.debug("Render {} → Geo {}", render, geo);
        return geo;
    }

    /**
     * Geographic to render: removes offset and scale, then applies the inverse rotation.
     *
     * @param geo        geographic position
     * @param parameters fitted parameters
     * @return render position
     * @throws InverseUndefinedException if {@code scaleX} or {@code scaleY} is zero
     */
    public RenderPoint toRender(GeoPoint geo, TransformParameters parameters) {
        requireInvertible(parameters);

        double x = (geo.lon() - parameters.offsetX()) / parameters.scaleX();
        double y = (geo.lat() - parameters.offsetY()) / parameters.scaleY();

        double theta = parameters.rotationRadians();
        if (theta != 0.0) {
            double cos = Math.cos(-theta);
            double sin = Math.sin(-theta);
            double unrotatedX = x * cos - y * sin;
            double unrotatedY = x * sin + y * cos;
            x = unrotatedX;
            y = unrotatedY;
        }

        RenderPoint render = new RenderPoint(x, y);
        logger.debug("Geo {} → Render {}", geo, render);
        return render;
    }

    /**
     * Expresses the forward mapping as an affine matrix taking render {@code (x, y)} to
     * geographic {@code (lon, lat)}.
     *
     * <pre>
     * | lon |   | sx·cosθ  −sx·sinθ  offsetX |   | x |
     * | lat | = | sy·sinθ   sy·cosθ  offsetY | · | y |
     *                                            | 1 |
     * </pre>
     *
     * @param parameters fitted parameters
     * @return the equivalent transform
     */
    public AffineTransform toAffineTransform(TransformParameters parameters) {
        double cos = Math.cos(parameters.rotationRadians());
        double sin = Math.sin(parameters.rotationRadians());
        double sx = parameters.scaleX();
        double sy = parameters.scaleY();
        return new AffineTransform(
                sx * cos, sy * sin,
                -sx * sin, sy * cos,
                parameters.offsetX(), parameters.offsetY());
    }

    private static void requireInvertible(TransformParameters parameters) {
        if (parameters.scaleX() == 0.0) {
            throw new InverseUndefinedException("x",
                    "Cannot convert to render space: scaleX is 0 (zero longitude span in calibration points)");
        }
        if (parameters.scaleY() == 0.0) {
            throw new InverseUndefinedException("y",
                    "Cannot convert to render space: scaleY is 0 (zero latitude span in calibration points)");
        }
    }
}
