package com.mapcal.geocal.utilities;

import com.mapcal.geocal.model.CorrespondencePoint;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.RenderPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Append-only list of observed correspondence points.
 *
 * <p>Points are stamped from a monotonic clock when added and are never modified; the only
 * way to remove them is {@link #clear()}. Duplicate or physically implausible points are
 * accepted as given.</p>
 *
 * @since 0.1.0
 */
public class CalibrationStore {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationStore.class);

    private final List<CorrespondencePoint> points = new ArrayList<>();
    private final LongSupplier clock;
    private long nextSequence = 0;

    public CalibrationStore() {
        this(System::nanoTime);
    }

    /**
     * @param clock monotonic time source used to stamp new points
     */
    public CalibrationStore(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a correspondence point stamped with the current clock reading.
     *
     * @param render observed render position
     * @param geo    observed geographic position
     * @return the stored point
     */
    public CorrespondencePoint addPoint(RenderPoint render, GeoPoint geo) {
        CorrespondencePoint point = new CorrespondencePoint(render, geo, clock.getAsLong(), nextSequence++);
        points.add(point);
        logger.debug("Stored correspondence #{}: render {} -> geo {}", points.size(), render, geo);
        return point;
    }

    /**
     * Discards every stored point.
     */
    public void clear() {
        points.clear();
        nextSequence = 0;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return unmodifiable view of the points in insertion order
     */
    public List<CorrespondencePoint> getPoints() {
        return Collections.unmodifiableList(points);
    }
}
