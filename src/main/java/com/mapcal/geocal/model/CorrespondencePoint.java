package com.mapcal.geocal.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One observation tying a render-space location to the geographic location it was
 * confirmed to represent at the same moment.
 *
 * <p>{@code observedAt} is a monotonic clock reading kept for diagnostics; it never
 * expires a point. {@code sequence} is the insertion index assigned by the store and is
 * what ranks observations by recency. Raw {@link System#nanoTime()} values may wrap, so
 * they are not compared directly.</p>
 *
 * @param render     observed render position
 * @param geo        observed geographic position
 * @param observedAt monotonic timestamp (nanoseconds)
 * @param sequence   insertion index within the owning store
 * @since 0.1.0
 */
public record CorrespondencePoint(RenderPoint render, GeoPoint geo, long observedAt, long sequence) {

    /** Newest observation first, by insertion sequence. */
    public static final Comparator<CorrespondencePoint> MOST_RECENT_FIRST =
            Comparator.comparingLong(CorrespondencePoint::sequence).reversed();

    public CorrespondencePoint {
        Objects.requireNonNull(render, "render");
        Objects.requireNonNull(geo, "geo");
    }

    public double renderX() {
        return render.x();
    }

    public double renderY() {
        return render.y();
    }

    public double geoLat() {
        return geo.lat();
    }

    public double geoLon() {
        return geo.lon();
    }
}
