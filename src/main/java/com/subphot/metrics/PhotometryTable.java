package com.subphot.metrics;

/**
 * Per-source magnitude, magnitude error and quality flag read from one photometry list.
 */
public final class PhotometryTable {
    public final double[] magnitudes;
    public final double[] errors;
    public final boolean[] good;

    public PhotometryTable(double[] magnitudes, double[] errors, boolean[] good) {
        if (magnitudes.length != errors.length || magnitudes.length != good.length) {
            throw new IllegalArgumentException("photometry columns differ in length");
        }
        this.magnitudes = magnitudes;
        this.errors = errors;
        this.good = good;
    }

    public int size() {
        return magnitudes.length;
    }

    public int goodCount() {
        int count = 0;
        for (boolean flag : good) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    public double[] goodMagnitudes() {
        return selectGood(magnitudes);
    }

    public double[] goodErrors() {
        return selectGood(errors);
    }

    private double[] selectGood(double[] column) {
        double[] out = new double[goodCount()];
        int j = 0;
        for (int i = 0; i < column.length; i++) {
            if (good[i]) {
                out[j++] = column[i];
            }
        }
        return out;
    }
}
