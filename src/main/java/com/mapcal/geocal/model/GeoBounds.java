package com.mapcal.geocal.model;

import java.util.Objects;

/**
 * Geographic viewport reported by the map provider, as its north-east and south-west corners.
 *
 * @param northEast north-east corner
 * @param southWest south-west corner
 * @since 0.1.0
 */
public record GeoBounds(GeoPoint northEast, GeoPoint southWest) {

    public GeoBounds {
        Objects.requireNonNull(northEast, "northEast");
        Objects.requireNonNull(southWest, "southWest");
    }

    public static GeoBounds of(double northLat, double eastLon, double southLat, double westLon) {
        return new GeoBounds(new GeoPoint(northLat, eastLon), new GeoPoint(southLat, westLon));
    }

    public double latSpan() {
        return northEast.lat() - southWest.lat();
    }

    public double lonSpan() {
        return northEast.lon() - southWest.lon();
    }

    /**
     * @return the midpoint of the two corners
     */
    public GeoPoint center() {
        return new GeoPoint(
                (northEast.lat() + southWest.lat()) / 2.0,
                (northEast.lon() + southWest.lon()) / 2.0);
    }
}
