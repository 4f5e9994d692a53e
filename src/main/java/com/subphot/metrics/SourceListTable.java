package com.subphot.metrics;

/**
 * Background, seeing (S) and roundness (D) columns of one source-detection list.
 */
public final class SourceListTable {
    public final double[] background;
    public final double[] sValues;
    public final double[] dValues;

    public SourceListTable(double[] background, double[] sValues, double[] dValues) {
        this.background = background;
        this.sValues = sValues;
        this.dValues = dValues;
    }

    public int size() {
        return background.length;
    }
}
