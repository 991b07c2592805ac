package com.mapcal.geocal.model;

/**
 * A position in render space: pixel-like coordinates on the client viewport,
 * with x increasing to the right and y increasing downward.
 *
 * @param x horizontal render coordinate
 * @param y vertical render coordinate
 * @since 0.1.0
 */
public record RenderPoint(double x, double y) {

    public static final RenderPoint ORIGIN = new RenderPoint(0.0, 0.0);

    @Override
    public String toString() {
        return String.format("(%.3f, %.3f)", x, y);
    }
}
