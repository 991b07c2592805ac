package com.mapcal.geocal.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.mapcal.geocal.model.AccuracyStatistics;
import com.mapcal.geocal.model.CalibrationStatus;
import com.mapcal.geocal.model.TransformParameters;

import java.util.OptionalDouble;

/**
 * JSON snapshots of calibration state for logs and diagnostics panels.
 * Rotation is reported in degrees.
 *
 * @since 0.1.0
 */
public final class CalibrationReport {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    private CalibrationReport() {
    }

    /**
     * @param status        calibrator status
     * @param residualError RMS residual in degrees, if calibrated
     * @return pretty-printed JSON
     */
    public static String toJson(CalibrationStatus status, OptionalDouble residualError) {
        TransformParameters p = status.parameters();

        JsonObject parameters = new JsonObject();
        parameters.addProperty("scaleX", p.scaleX());
        parameters.addProperty("scaleY", p.scaleY());
        parameters.addProperty("offsetX", p.offsetX());
        parameters.addProperty("offsetY", p.offsetY());
        parameters.addProperty("rotationDegrees", p.rotationDegrees());

        JsonObject root = new JsonObject();
        root.addProperty("pointsCount", status.pointCount());
        root.addProperty("isCalibrated", status.calibrated());
        root.add("parameters", parameters);
        if (residualError.isPresent()) {
            root.addProperty("residualErrorDegrees", residualError.getAsDouble());
        }
        return GSON.toJson(root);
    }

    /**
     * @param stats accuracy statistics
     * @return pretty-printed JSON
     */
    public static String toJson(AccuracyStatistics stats) {
        return GSON.toJson(stats);
    }
}
