package com.mapcal.geocal.model;

import java.util.Objects;

/**
 * A converted point together with the method that produced it.
 *
 * @param point  the converted point
 * @param method how it was obtained
 * @param <P>    {@link RenderPoint} or {@link GeoPoint}
 * @since 0.1.0
 */
public record Projection<P>(P point, ProjectionMethod method) {

    public Projection {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(method, "method");
    }

    public static <P> Projection<P> calibrated(P point) {
        return new Projection<>(point, ProjectionMethod.CALIBRATED);
    }

    public static <P> Projection<P> provider(P point) {
        return new Projection<>(point, ProjectionMethod.PROVIDER);
    }

    public static <P> Projection<P> linear(P point) {
        return new Projection<>(point, ProjectionMethod.LINEAR_ESTIMATE);
    }

    public static <P> Projection<P> degraded(P point) {
        return new Projection<>(point, ProjectionMethod.DEGRADED);
    }

    public boolean isDegraded() {
        return method == ProjectionMethod.DEGRADED;
    }
}
