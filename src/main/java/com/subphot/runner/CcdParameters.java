package com.subphot.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Detector gain, exposure time and zeropoint magnitude used by the photometry transforms.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CcdParameters {
    public final double gain;
    public final double exposureTime;
    public final double zeropoint;

    /**
     * Template values {@code gain}, {@code exptime} and {@code zeropoint}.
     */
    public Map<String, String> asParams() {
        return Map.of(
                "gain", format(gain),
                "exptime", format(exposureTime),
                "zeropoint", format(zeropoint)
        );
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
