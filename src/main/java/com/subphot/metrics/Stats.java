package com.subphot.metrics;

import java.util.Arrays;

/**
 * NaN-ignoring order statistics.
 */
public final class Stats {
    private Stats() {
    }

    /**
     * Median of the finite values; NaN when there are none.
     */
    public static double nanMedian(double[] values) {
        double[] finite = Arrays.stream(values).filter(Double::isFinite).sorted().toArray();
        int n = finite.length;
        if (n == 0) {
            return Double.NaN;
        }
        if (n % 2 == 1) {
            return finite[n / 2];
        }
        return (finite[n / 2 - 1] + finite[n / 2]) / 2.0;
    }

    /**
     * Median absolute deviation about the median.
     */
    public static double nanMad(double[] values) {
        double center = nanMedian(values);
        if (!Double.isFinite(center)) {
            return Double.NaN;
        }
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return nanMedian(deviations);
    }
}
