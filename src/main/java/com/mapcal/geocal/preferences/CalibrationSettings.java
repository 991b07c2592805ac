package com.mapcal.geocal.preferences;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CalibrationSettings
 *
 * <p>Tunable constants for the calibration engine, read from YAML:
 *   - The bundled {@code calibration-defaults.yml} is always loaded first.
 *   - An optional user file is merged over it, section by section.
 *   - Type safe getters walk nested keys and fall back to compiled defaults on
 *     missing or malformed values.
 *
 * <p>The bundled values (3 points to calibrate, a window of the 10 most recent points,
 * 4 points before rotation is estimated) are the engine's reference behaviour. The
 * calibration keys are only checked for consistency with each other, not pinned to
 * those values: raising {@code minimum_points} moves the calibrated threshold and a
 * larger {@code recent_point_window} lets one recompute see more than 10 points.
 * Deployments that override them opt out of the reference behaviour.</p>
 *
 * <p>Instances are immutable once loaded, so one settings object can be shared by any
 * number of calibrators.</p>
 *
 * @since 0.1.0
 */
public class CalibrationSettings {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationSettings.class);

    static final String DEFAULTS_RESOURCE = "/com/mapcal/geocal/calibration-defaults.yml";

    private static final int DEFAULT_MINIMUM_POINTS = 3;
    private static final int DEFAULT_RECENT_POINT_WINDOW = 10;
    private static final int DEFAULT_ROTATION_MINIMUM_POINTS = 4;
    private static final int DEFAULT_HISTORY_SIZE = 100;
    private static final int DEFAULT_RECENT_ACCURACY_WINDOW = 10;
    private static final double DEFAULT_PERFECT_THRESHOLD_M = 1.0;
    private static final double DEFAULT_GOOD_THRESHOLD_M = 10.0;
    private static final double DEFAULT_MAX_DISTANCE_M = 100.0;

    private final Map<String, Object> configData;

    private final int minimumPoints;
    private final int recentPointWindow;
    private final int rotationMinimumPoints;
    private final int historySize;
    private final int recentAccuracyWindow;
    private final double perfectThresholdMeters;
    private final double goodThresholdMeters;
    private final double maxDistanceMeters;

    private CalibrationSettings(Map<String, Object> configData) {
        this.configData = configData;

        this.minimumPoints = getInteger(DEFAULT_MINIMUM_POINTS, "calibration", "minimum_points");
        this.recentPointWindow = getInteger(DEFAULT_RECENT_POINT_WINDOW, "calibration", "recent_point_window");
        this.rotationMinimumPoints = getInteger(DEFAULT_ROTATION_MINIMUM_POINTS, "calibration", "rotation_minimum_points");
        this.historySize = getInteger(DEFAULT_HISTORY_SIZE, "accuracy", "history_size");
        this.recentAccuracyWindow = getInteger(DEFAULT_RECENT_ACCURACY_WINDOW, "accuracy", "recent_window");
        this.perfectThresholdMeters = getDouble(DEFAULT_PERFECT_THRESHOLD_M, "accuracy", "perfect_threshold_m");
        this.goodThresholdMeters = getDouble(DEFAULT_GOOD_THRESHOLD_M, "accuracy", "good_threshold_m");
        this.maxDistanceMeters = getDouble(DEFAULT_MAX_DISTANCE_M, "accuracy", "max_distance_m");

        validate();
    }

    /**
     * Loads the bundled defaults only.
     *
     * @return settings backed by {@code calibration-defaults.yml}
     */
    public static CalibrationSettings load() {
        return new CalibrationSettings(loadBundledDefaults());
    }

    /**
     * Loads the bundled defaults and merges the given user file over them.
     *
     * @param userFile YAML file with overrides
     * @return merged settings
     * @throws IOException if the file cannot be read
     */
    public static CalibrationSettings load(Path userFile) throws IOException {
        Map<String, Object> merged = loadBundledDefaults();
        try (InputStream in = Files.newInputStream(userFile)) {
            Map<String, Object> overrides = parse(in, userFile.toString());
            mergeInto(merged, overrides);
        }
        logger.info("Loaded calibration settings from {}", userFile);
        return new CalibrationSettings(merged);
    }

    /**
     * Builds settings from an in-memory map, as it would be parsed from YAML.
     * Keys missing from the map take their bundled defaults.
     *
     * @param overrides nested configuration map
     * @return merged settings
     */
    public static CalibrationSettings fromMap(Map<String, Object> overrides) {
        Map<String, Object> merged = loadBundledDefaults();
        mergeInto(merged, overrides);
        return new CalibrationSettings(merged);
    }

    private static Map<String, Object> loadBundledDefaults() {
        try (InputStream in = CalibrationSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Bundled settings {} not found; using compiled defaults", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(in, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            logger.error("Error reading bundled settings {}", DEFAULTS_RESOURCE, e);
            return new LinkedHashMap<>();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        Object loaded = new Yaml().load(in);
        if (loaded == null) {
            return new LinkedHashMap<>();
        }
        if (loaded instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) loaded);
        }
        throw new IllegalArgumentException("YAML root is not a map: " + source);
    }

    @SuppressWarnings("unchecked")
    private static void mergeInto(Map<String, Object> target, Map<String, Object> overrides) {
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map<?, ?> existingMap && entry.getValue() instanceof Map<?, ?> overrideMap) {
                Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) existingMap);
                mergeInto(copy, (Map<String, Object>) overrideMap);
                target.put(entry.getKey(), copy);
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private void validate() {
        if (minimumPoints < 3) {
            throw new IllegalArgumentException(
                    "calibration.minimum_points must be at least 3, was " + minimumPoints);
        }
        if (recentPointWindow < minimumPoints) {
            throw new IllegalArgumentException(String.format(
                    "calibration.recent_point_window (%d) must not be smaller than minimum_points (%d)",
                    recentPointWindow, minimumPoints));
        }
        if (rotationMinimumPoints < minimumPoints) {
            throw new IllegalArgumentException(String.format(
                    "calibration.rotation_minimum_points (%d) must not be smaller than minimum_points (%d)",
                    rotationMinimumPoints, minimumPoints));
        }
        if (historySize < 1 || recentAccuracyWindow < 1) {
            throw new IllegalArgumentException("accuracy.history_size and accuracy.recent_window must be positive");
        }
        if (!(perfectThresholdMeters < goodThresholdMeters && goodThresholdMeters < maxDistanceMeters)) {
            throw new IllegalArgumentException(String.format(
                    "accuracy thresholds must increase: perfect=%s, good=%s, max=%s",
                    perfectThresholdMeters, goodThresholdMeters, maxDistanceMeters));
        }
    }

    /**
     * Retrieve a nested value, or null if any key along the path is missing.
     *
     * @param keys sequence of keys, e.g. "calibration", "minimum_points"
     * @return the value at the end of the path, or null
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private int getInteger(int fallback, String... keys) {
        Object v = getConfigItem(keys);
        if (v == null) {
            return fallback;
        }
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}; using {}", String.join("/", keys), v, fallback);
            return fallback;
        }
    }

    private double getDouble(double fallback, String... keys) {
        Object v = getConfigItem(keys);
        if (v == null) {
            return fallback;
        }
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}; using {}", String.join("/", keys), v, fallback);
            return fallback;
        }
    }

    /** Points needed before the fitted transform is used. */
    public int getMinimumPoints() {
        return minimumPoints;
    }

    /** Most recent points considered by one recompute. */
    public int getRecentPointWindow() {
        return recentPointWindow;
    }

    /** Selected points needed before rotation is estimated. */
    public int getRotationMinimumPoints() {
        return rotationMinimumPoints;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getRecentAccuracyWindow() {
        return recentAccuracyWindow;
    }

    public double getPerfectThresholdMeters() {
        return perfectThresholdMeters;
    }

    public double getGoodThresholdMeters() {
        return goodThresholdMeters;
    }

    public double getMaxDistanceMeters() {
        return maxDistanceMeters;
    }
}
