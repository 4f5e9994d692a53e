package com.subphot.model;

import java.util.Locale;

/**
 * Named per-frame scalar metrics. The key is the stable name used in the metrics cache.
 */
public enum MetricName {
    SEEING("seeing"),
    ROUNDNESS("roundness"),
    BACKGROUND("background"),
    GOOD_DETECTIONS("good_detections"),
    MEDIAN_MAG_ERROR("median_mag_error"),
    MAG_ERROR_MAD("mag_error_mad"),
    HOUR_ANGLE("hour_angle"),
    ZENITH_DISTANCE("zenith_distance"),
    MOON_PHASE("moon_phase"),
    MOON_ELEVATION("moon_elevation"),
    MOON_DISTANCE("moon_distance"),
    GAIN("gain"),
    EXPOSURE_TIME("exposure_time");

    private final String key;

    MetricName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static MetricName fromKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (MetricName name : values()) {
            if (name.key.equals(normalized)) {
                return name;
            }
        }
        throw new IllegalArgumentException("unknown metric: " + key);
    }
}
