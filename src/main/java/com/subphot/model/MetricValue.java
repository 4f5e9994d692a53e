package com.subphot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A metric that was either computed or is unavailable. Unavailable metrics carry NaN and are never
 * replaced by a sentinel.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MetricValue {
    private static final MetricValue UNAVAILABLE = new MetricValue(Double.NaN, false);

    public final double value;
    public final boolean computed;

    public static MetricValue of(double value) {
        if (!Double.isFinite(value)) {
            return UNAVAILABLE;
        }
        return new MetricValue(value, true);
    }

    public static MetricValue unavailable() {
        return UNAVAILABLE;
    }
}
