package com.subphot.runner;

import java.util.Locale;

/**
 * Pipeline stages in execution order.
 */
public enum StageName {
    REGISTER("register"),
    SELECT_REFERENCES("select_references"),
    CONVOLVE("convolve"),
    COMBINE("combine"),
    REFERENCE_PHOTOMETRY("reference_photometry"),
    SUBTRACT("subtract"),
    DIFFERENTIAL_PHOTOMETRY("differential_photometry"),
    COLLECT("collect");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static StageName parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (StageName stage : values()) {
            if (stage.key.equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("unknown stage: " + raw);
    }
}
