package com.mapcal.geocal.service;

import com.mapcal.geocal.model.GeoBounds;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.RenderPoint;

import java.util.Optional;

/**
 * The external map component that owns the authoritative geographic viewport.
 *
 * <p>Every method may decline by returning an empty {@link Optional}; the calibrator then
 * falls back to a coarser estimate rather than failing.</p>
 *
 * @since 0.1.0
 */
public interface MapProvider {

    /**
     * Provider's own render to geographic conversion.
     *
     * @param render render position
     * @return the geographic position, or empty if the provider cannot compute one
     */
    Optional<GeoPoint> renderToGeographic(RenderPoint render);

    /**
     * Provider's own geographic to render conversion.
     *
     * @param geo geographic position
     * @return the render position, or empty if the provider cannot compute one
     */
    Optional<RenderPoint> geographicToRender(GeoPoint geo);

    /**
     * @return the current geographic viewport bounds, or empty when unavailable
     */
    Optional<GeoBounds> viewportBounds();

    /**
     * @return the current geographic viewport center, or empty when unavailable
     */
    Optional<GeoPoint> viewportCenter();
}
