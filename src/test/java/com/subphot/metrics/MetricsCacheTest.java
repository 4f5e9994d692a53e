package com.subphot.metrics;

import com.subphot.model.FrameFiles;
import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import com.subphot.model.MetricValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsCacheTest {

    @TempDir
    Path dir;

    private static FrameRecord record(String name, double seeing) {
        Map<MetricName, MetricValue> metrics = new EnumMap<>(MetricName.class);
        metrics.put(MetricName.SEEING, MetricValue.of(seeing));
        metrics.put(MetricName.HOUR_ANGLE, MetricValue.unavailable());
        return new FrameRecord(Path.of("/frames", name + ".fits"), Path.of("/frames", name + ".fistar"),
                Path.of("/frames", name + ".fiphot"), metrics);
    }

    @Test
    void loadShouldReturnWhatWasSaved() throws Exception {
        MetricsCache cache = new MetricsCache();
        cache.save(dir, "metrics.json", List.of(record("a", 2.5), record("b", 3.0)));

        Optional<List<FrameRecord>> loaded = cache.load(dir, "metrics.json");

        assertTrue(loaded.isPresent());
        assertEquals(2, loaded.get().size());
        FrameRecord first = loaded.get().get(0);
        assertEquals(Path.of("/frames", "a.fits"), first.frame);
        assertEquals(2.5, first.value(MetricName.SEEING), 1e-12);
        assertFalse(first.metric(MetricName.HOUR_ANGLE).computed);
    }

    @Test
    void loadShouldIgnoreCorruptSnapshotAsAWhole() throws Exception {
        Files.writeString(dir.resolve("metrics.json"),
                "{\"version\":1,\"frames\":[{\"frame\":\"/a.fits\",\"source_list\":\"/a.fistar\","
                        + "\"photometry\":\"/a.fiphot\",\"metrics\":{\"seeing\":2}},{\"frame\":\"/b.fits\"}]}");

        assertTrue(new MetricsCache().load(dir, "metrics.json").isEmpty());
    }

    @Test
    void invalidateShouldRemoveSnapshot() throws Exception {
        MetricsCache cache = new MetricsCache();
        cache.save(dir, "metrics.json", List.of(record("a", 2.5)));

        assertTrue(cache.invalidate(dir, "metrics.json"));
        assertTrue(cache.load(dir, "metrics.json").isEmpty());
        assertFalse(cache.invalidate(dir, "metrics.json"));
    }

    @Test
    void collectorShouldPreferCacheUnlessForced() throws Exception {
        MetricsCache cache = new MetricsCache();
        cache.save(dir, "metrics.json", List.of(record("cached", 4.0)));
        MetricsCollector collector = new MetricsCollector(
                new MetricExtractor((frame, keywords) -> Map.of()), cache);
        List<FrameFiles> frames = List.of(new FrameFiles(
                dir.resolve("gone.fits"), dir.resolve("gone.fistar"), dir.resolve("gone.fiphot")));

        MetricsCollector.Table cached = collector.collect(frames, dir, "metrics.json", false);
        assertTrue(cached.fromCache);
        assertEquals(Path.of("/frames", "cached.fits"), cached.records.get(0).frame);

        MetricsCollector.Table recomputed = collector.collect(frames, dir, "metrics.json", true);
        assertFalse(recomputed.fromCache);
        assertTrue(recomputed.records.isEmpty());
        assertEquals(1, recomputed.rejected.size());
        assertTrue(cache.load(dir, "metrics.json").isEmpty());
    }

    @Test
    void collectorShouldNotCacheTableWithoutUsableFrames() throws Exception {
        MetricsCache cache = new MetricsCache();
        MetricsCollector collector = new MetricsCollector(
                new MetricExtractor((frame, keywords) -> Map.of()), cache);

        MetricsCollector.Table empty = collector.collect(List.of(), dir, "photref.json", false);

        assertTrue(empty.records.isEmpty());
        assertFalse(Files.exists(cache.location(dir, "photref.json")));
        assertFalse(collector.collect(List.of(), dir, "photref.json", false).fromCache);
    }
}
