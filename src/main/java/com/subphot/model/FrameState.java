package com.subphot.model;

import java.util.Locale;

/**
 * Per-frame pipeline state. Ordinal order is progress order; REFERENCE_CANDIDATE and CONVOLVED are
 * only reached by frames picked as photometric references.
 */
public enum FrameState {
    DISCOVERED,
    REGISTERED,
    REFERENCE_CANDIDATE,
    CONVOLVED,
    SUBTRACTED,
    PHOTOMETRY_EXTRACTED,
    COLLECTED;

    public boolean atLeast(FrameState other) {
        return other == null || ordinal() >= other.ordinal();
    }

    public static FrameState parse(String raw, FrameState fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
