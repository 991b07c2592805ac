package com.mapcal.geocal.model;

/**
 * A position in geographic space, in decimal degrees.
 *
 * <p>Kept separate from {@link RenderPoint} so a latitude/longitude pair can never be
 * passed where a render position is expected. Note the component order: latitude first,
 * which is the y-analog when the engine treats geographic space as a plane.</p>
 *
 * @param lat latitude in degrees
 * @param lon longitude in degrees
 * @since 0.1.0
 */
public record GeoPoint(double lat, double lon) {

    public static final GeoPoint ORIGIN = new GeoPoint(0.0, 0.0);

    @Override
    public String toString() {
        return String.format("[%.6f, %.6f]", lat, lon);
    }
}
