package com.subphot.metrics;

import com.subphot.core.diagnostics.CauseCode;
import com.subphot.core.diagnostics.Outcome;
import com.subphot.model.FrameFiles;
import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricExtractorTest {
    private static final FrameHeaderReader HEADER = (frame, keywords) -> Map.of(
            "HA", 1.5,
            "Z", 20.0,
            "MOONPH", 10.0,
            "MOONELEV", -5.0,
            "MOONDIST", 90.0,
            "GAIN1", 2.0,
            "GAIN2", 4.0,
            "EXPTIME", 30.0
    );

    @TempDir
    Path dir;

    private FrameFiles writeFrame(String photometry) throws IOException {
        Path frame = Files.writeString(dir.resolve("1-000001_5.fits"), "");
        Path sources = Files.writeString(dir.resolve("1-000001_5.fistar"), String.join("\n",
                "# id x y bg amp s d",
                "1 100.0 200.0 50.0 0 2.0 0.1",
                "2 300.0 400.0 60.0 0 3.0 -0.2",
                "3 500.0 600.0 70.0 0 4.0 0.3",
                ""));
        Path phot = Files.writeString(dir.resolve("1-000001_5.fiphot"), photometry);
        return new FrameFiles(frame, sources, phot);
    }

    private static String photometryRow(double mag, double err, String flag) {
        return "1 2 3 4 5 6 7 8 9 10 11 12 " + mag + " " + err + " " + flag;
    }

    private static String textPhotometry() {
        return String.join("\n",
                "# text photometry",
                photometryRow(10.0, 0.01, "G"),
                photometryRow(11.0, 0.03, "G"),
                photometryRow(12.0, 0.02, "G"),
                photometryRow(9.0, 0.5, "X"),
                "");
    }

    @Test
    void extract_shouldComputeDetectionPhotometryAndHeaderMetrics() throws Exception {
        FrameFiles files = writeFrame(textPhotometry());

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER).extract(files);

        assertTrue(outcome.success);
        FrameRecord record = outcome.value;
        assertEquals(3.0, record.value(MetricName.SEEING), 1e-9);
        assertEquals(0.1, record.value(MetricName.ROUNDNESS), 1e-9);
        assertEquals(60.0, record.value(MetricName.BACKGROUND), 1e-9);
        assertEquals(3.0, record.value(MetricName.GOOD_DETECTIONS), 1e-9);
        assertEquals(0.02, record.value(MetricName.MEDIAN_MAG_ERROR), 1e-9);
        assertEquals(1.0, record.value(MetricName.MAG_ERROR_MAD), 1e-9);
        assertEquals(1.5, record.value(MetricName.HOUR_ANGLE), 1e-9);
        assertEquals(3.0, record.value(MetricName.GAIN), 1e-9);
        assertEquals(30.0, record.value(MetricName.EXPOSURE_TIME), 1e-9);
    }

    @Test
    void extract_shouldRejectFrameWithMissingCompanion() throws Exception {
        FrameFiles files = writeFrame(textPhotometry());
        Files.delete(files.photometry);

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER).extract(files);

        assertFalse(outcome.success);
        assertEquals(CauseCode.MISSING_COMPANION_FILE, outcome.causeCode);
    }

    @Test
    void extract_shouldSkipBinaryPhotometryWithoutReader() throws Exception {
        FrameFiles files = writeFrame("# fiphot --binary-output\n\u0001\u0002\u0003");

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER).extract(files);

        assertFalse(outcome.success);
        assertEquals(CauseCode.BINARY_READER_UNAVAILABLE, outcome.causeCode);
    }

    @Test
    void extract_shouldUseInstalledBinaryReader() throws Exception {
        FrameFiles files = writeFrame("# fiphot --binary-output\n\u0001\u0002\u0003");
        PhotometryReader binary = path -> new PhotometryTable(
                new double[]{10.0, 10.5},
                new double[]{0.02, 0.04},
                new boolean[]{true, true}
        );

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER, binary).extract(files);

        assertTrue(outcome.success);
        assertEquals(2.0, outcome.value.value(MetricName.GOOD_DETECTIONS), 1e-9);
        assertEquals(0.03, outcome.value.value(MetricName.MEDIAN_MAG_ERROR), 1e-9);
    }

    @Test
    void extract_shouldRejectMalformedPhotometry() throws Exception {
        FrameFiles files = writeFrame("1 2 3\n");

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER).extract(files);

        assertFalse(outcome.success);
        assertEquals(CauseCode.UNREADABLE_METRIC, outcome.causeCode);
    }

    @Test
    void extract_shouldLeaveHeaderMetricsUnavailableWhenHeaderIsUnreadable() throws Exception {
        FrameFiles files = writeFrame(textPhotometry());
        FrameHeaderReader broken = (frame, keywords) -> {
            throw new IOException("not a FITS file");
        };

        Outcome<FrameRecord> outcome = new MetricExtractor(broken).extract(files);

        assertTrue(outcome.success);
        assertTrue(outcome.value.hasAll(List.of(MetricName.SEEING, MetricName.GOOD_DETECTIONS)));
        assertFalse(outcome.value.metric(MetricName.HOUR_ANGLE).computed);
        assertTrue(Double.isNaN(outcome.value.value(MetricName.ZENITH_DISTANCE)));
    }

    @Test
    void extract_shouldTreatMedianOverNoGoodSourcesAsUnavailable() throws Exception {
        FrameFiles files = writeFrame(photometryRow(9.0, 0.5, "X") + "\n");

        Outcome<FrameRecord> outcome = new MetricExtractor(HEADER).extract(files);

        assertTrue(outcome.success);
        assertEquals(0.0, outcome.value.value(MetricName.GOOD_DETECTIONS), 1e-9);
        assertFalse(outcome.value.metric(MetricName.MEDIAN_MAG_ERROR).computed);
    }
}
