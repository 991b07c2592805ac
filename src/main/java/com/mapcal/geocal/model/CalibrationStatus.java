package com.mapcal.geocal.model;

/**
 * Read-only snapshot of a calibrator, computed on request.
 *
 * @param pointCount number of stored correspondence points
 * @param calibrated whether enough points exist for the fitted transform to be used
 * @param parameters transform parameters at the time of the snapshot
 * @since 0.1.0
 */
public record CalibrationStatus(int pointCount, boolean calibrated, TransformParameters parameters) {

    public boolean isCalibrated() {
        return calibrated;
    }

    /**
     * @return the rotation in degrees, for display
     */
    public double rotationDegrees() {
        return parameters.rotationDegrees();
    }
}
