package com.mapcal.geocal.model;

/**
 * The five scalars of the fitted render to geographic transform.
 *
 * <p>Forward mapping, with {@code θ = rotationRadians}:</p>
 * <pre>
 * x' = x·cosθ − y·sinθ
 * y' = x·sinθ + y·cosθ
 * lon = x'·scaleX + offsetX
 * lat = y'·scaleY + offsetY
 * </pre>
 *
 * <p>Instances are immutable; the owning calibrator replaces its value wholesale on every
 * recompute, so readers always see a complete parameter set.</p>
 *
 * @param scaleX          degrees of longitude per render unit along x
 * @param scaleY          degrees of latitude per render unit along y
 * @param offsetX         longitude offset
 * @param offsetY         latitude offset
 * @param rotationRadians rotational misalignment between the two spaces
 * @since 0.1.0
 */
public record TransformParameters(
        double scaleX,
        double scaleY,
        double offsetX,
        double offsetY,
        double rotationRadians) {

    /** Uncalibrated parameters: unit scale, no offset, no rotation. */
    public static final TransformParameters DEFAULTS = new TransformParameters(1.0, 1.0, 0.0, 0.0, 0.0);

    public double rotationDegrees() {
        return Math.toDegrees(rotationRadians);
    }

    /**
     * @return true if neither scale factor is zero, so {@code toRender} is defined
     */
    public boolean isInvertible() {
        return scaleX != 0.0 && scaleY != 0.0;
    }

    @Override
    public String toString() {
        return String.format("scale=(%.9f, %.9f), offset=(%.9f, %.9f), rotation=%.3f°",
                scaleX, scaleY, offsetX, offsetY, rotationDegrees());
    }
}
