package com.subphot.metrics;

import java.util.List;
import java.util.Map;

/**
 * Observing-condition and detector keywords read from frame headers.
 */
public final class HeaderKeywords {
    public static final String HOUR_ANGLE = "HA";
    public static final String ZENITH_DISTANCE = "Z";
    public static final String MOON_PHASE = "MOONPH";
    public static final String MOON_ELEVATION = "MOONELEV";
    public static final String MOON_DISTANCE = "MOONDIST";
    public static final String GAIN = "GAIN";
    public static final String GAIN1 = "GAIN1";
    public static final String GAIN2 = "GAIN2";
    public static final String EXPTIME = "EXPTIME";

    public static final List<String> ALL = List.of(
            HOUR_ANGLE, ZENITH_DISTANCE, MOON_PHASE, MOON_ELEVATION, MOON_DISTANCE,
            GAIN, GAIN1, GAIN2, EXPTIME
    );
    public static final List<String> DETECTOR = List.of(GAIN, GAIN1, GAIN2, EXPTIME);

    private HeaderKeywords() {
    }

    /**
     * Mean of the two amplifier gains when both are present, else the single gain, else NaN.
     */
    public static double gain(Map<String, Double> header) {
        Double gain1 = header.get(GAIN1);
        Double gain2 = header.get(GAIN2);
        if (gain1 != null && gain2 != null) {
            return (gain1 + gain2) / 2.0;
        }
        Double gain = header.get(GAIN);
        return gain == null ? Double.NaN : gain;
    }

    public static double value(Map<String, Double> header, String keyword) {
        Double value = header.get(keyword);
        return value == null ? Double.NaN : value;
    }
}
