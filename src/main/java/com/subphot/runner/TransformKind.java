package com.subphot.runner;

/**
 * External transforms the pipeline drives; each has a command template under {@code transform.<key>.cmd}.
 */
public enum TransformKind {
    XYSDK("xysdk"),
    SHIFT("shift"),
    REGISTER("register"),
    PHOTREF_CONVOLVE("photref_convolve"),
    COMBINE("combine"),
    REFERENCE_PHOTOMETRY("reference_photometry"),
    SUBTRACT("subtract"),
    SUBTRACTED_PHOTOMETRY("subtracted_photometry"),
    COLLECT("collect");

    private final String key;

    TransformKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String configKey() {
        return "transform." + key + ".cmd";
    }
}
