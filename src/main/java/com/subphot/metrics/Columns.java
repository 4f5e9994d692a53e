package com.subphot.metrics;

final class Columns {
    private Columns() {
    }

    static double parseOrNaN(String token) {
        if (token == null || token.isEmpty() || "-".equals(token)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
