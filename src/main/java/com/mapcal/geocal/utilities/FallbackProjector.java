package com.mapcal.geocal.utilities;

import com.mapcal.geocal.model.GeoBounds;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.Projection;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.service.MapProvider;
import com.mapcal.geocal.service.RenderHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Approximate conversions used until enough correspondence points exist.
 *
 * <p>Paths, tried in order:</p>
 * <ol>
 *   <li>The map provider's own conversion.</li>
 *   <li>A linear projection around the viewport center: degrees per pixel on each axis
 *       from the provider's geographic bounds and the render viewport size, no rotation,
 *       north up (render y grows as latitude shrinks).</li>
 *   <li>A placeholder tagged {@link com.mapcal.geocal.model.ProjectionMethod#DEGRADED}.</li>
 * </ol>
 *
 * @since 0.1.0
 */
public class FallbackProjector {
    private static final Logger logger = LoggerFactory.getLogger(FallbackProjector.class);

    private final MapProvider mapProvider;
    private final RenderHost renderHost;

    public FallbackProjector(MapProvider mapProvider, RenderHost renderHost) {
        this.mapProvider = Objects.requireNonNull(mapProvider, "mapProvider");
        this.renderHost = Objects.requireNonNull(renderHost, "renderHost");
    }

    /**
     * @param render render position
     * @return best available geographic estimate
     */
    public Projection<GeoPoint> toGeographic(RenderPoint render) {
        Optional<GeoPoint> direct = mapProvider.renderToGeographic(render);
        if (direct.isPresent()) {
            return Projection.provider(direct.get());
        }

        Optional<GeoBounds> bounds = mapProvider.viewportBounds();
        Optional<GeoPoint> center = geographicCenter(bounds);
        if (center.isEmpty()) {
            logger.debug("No geographic center or bounds available; {} maps to {}", render, GeoPoint.ORIGIN);
            return Projection.degraded(GeoPoint.ORIGIN);
        }

        double width = renderHost.viewportWidth();
        double height = renderHost.viewportHeight();
        if (bounds.isEmpty() || width <= 0 || height <= 0) {
            logger.debug("Cannot derive degrees per pixel (bounds={}, viewport={}x{}); using center {}",
                    bounds.orElse(null), width, height, center.get());
            return Projection.degraded(center.get());
        }

        double degreesPerPixelX = bounds.get().lonSpan() / width;
        double degreesPerPixelY = bounds.get().latSpan() / height;

        double offsetX = render.x() - width / 2.0;
        double offsetY = render.y() - height / 2.0;

        double lon = center.get().lon() + offsetX * degreesPerPixelX;
        double lat = center.get().lat() - offsetY * degreesPerPixelY;

        return Projection.linear(new GeoPoint(lat, lon));
    }

    /**
     * @param geo geographic position
     * @return best available render estimate
     */
    public Projection<RenderPoint> toRender(GeoPoint geo) {
        Optional<RenderPoint> direct = mapProvider.geographicToRender(geo);
        if (direct.isPresent()) {
            return Projection.provider(direct.get());
        }

        Optional<GeoBounds> bounds = mapProvider.viewportBounds();
        Optional<GeoPoint> center = geographicCenter(bounds);
        if (center.isEmpty()) {
            logger.debug("No geographic center or bounds available; {} maps to {}", geo, RenderPoint.ORIGIN);
            return Projection.degraded(RenderPoint.ORIGIN);
        }

        double width = renderHost.viewportWidth();
        double height = renderHost.viewportHeight();
        RenderPoint viewportCenter = new RenderPoint(width / 2.0, height / 2.0);
        if (bounds.isEmpty() || width <= 0 || height <= 0
                || bounds.get().lonSpan() == 0.0 || bounds.get().latSpan() == 0.0) {
            logger.debug("Cannot derive pixels per degree (bounds={}, viewport={}x{}); using viewport center {}",
                    bounds.orElse(null), width, height, viewportCenter);
            return Projection.degraded(viewportCenter);
        }

        double pixelsPerDegreeX = width / bounds.get().lonSpan();
        double pixelsPerDegreeY = height / bounds.get().latSpan();

        double offsetLon = geo.lon() - center.get().lon();
        double offsetLat = geo.lat() - center.get().lat();

        double x = viewportCenter.x() + offsetLon * pixelsPerDegreeX;
        double y = viewportCenter.y() - offsetLat * pixelsPerDegreeY;

        return Projection.linear(new RenderPoint(x, y));
    }

    private Optional<GeoPoint> geographicCenter(Optional<GeoBounds> bounds) {
        Optional<GeoPoint> reported = mapProvider.viewportCenter();
        if (reported.isPresent()) {
            return reported;
        }
        return bounds.map(GeoBounds::center);
    }
}
