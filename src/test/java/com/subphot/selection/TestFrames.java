package com.subphot.selection;

import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import com.subphot.model.MetricValue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class TestFrames {
    private TestFrames() {
    }

    static FrameRecord frame(int index, Map<MetricName, Double> values) {
        Map<MetricName, MetricValue> metrics = new EnumMap<>(MetricName.class);
        for (Map.Entry<MetricName, Double> entry : values.entrySet()) {
            metrics.put(entry.getKey(), MetricValue.of(entry.getValue()));
        }
        Path frame = Path.of("/data", String.format("1-%06d_5.fits", index));
        return new FrameRecord(frame, Path.of("/data", index + ".fistar"), Path.of("/data", index + ".fiphot"), metrics);
    }

    static List<FrameRecord> astrometric(double[] s, double[] d, double[] b, double[] n) {
        List<FrameRecord> out = new ArrayList<>();
        for (int i = 0; i < s.length; i++) {
            Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
            values.put(MetricName.SEEING, s[i]);
            values.put(MetricName.ROUNDNESS, d[i]);
            values.put(MetricName.BACKGROUND, b[i]);
            values.put(MetricName.GOOD_DETECTIONS, n[i]);
            out.add(frame(i, values));
        }
        return out;
    }

    /**
     * Frames observed in good conditions: low hour angle and zenith distance, moon up but below the horizon.
     */
    static List<FrameRecord> photometric(double[] n, double[] b, double[] e, double[] m) {
        List<FrameRecord> out = new ArrayList<>();
        for (int i = 0; i < n.length; i++) {
            out.add(frame(i, photometricValues(n[i], b[i], e[i], m[i])));
        }
        return out;
    }

    static Map<MetricName, Double> photometricValues(double n, double b, double e, double m) {
        Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
        values.put(MetricName.GOOD_DETECTIONS, n);
        values.put(MetricName.BACKGROUND, b);
        values.put(MetricName.MEDIAN_MAG_ERROR, e);
        values.put(MetricName.MAG_ERROR_MAD, m);
        values.put(MetricName.HOUR_ANGLE, -0.5);
        values.put(MetricName.ZENITH_DISTANCE, 12.0);
        values.put(MetricName.MOON_PHASE, 60.0);
        values.put(MetricName.MOON_ELEVATION, -25.0);
        return values;
    }

    static List<Integer> indices(List<FrameRecord> frames) {
        List<Integer> out = new ArrayList<>();
        for (FrameRecord record : frames) {
            String name = record.frame.getFileName().toString();
            out.add(Integer.parseInt(name.substring(2, 8)));
        }
        return out;
    }
}
