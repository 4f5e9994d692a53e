package com.subphot.metrics;

import com.subphot.core.diagnostics.Outcome;
import com.subphot.model.FrameFiles;
import com.subphot.model.FrameRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the metrics table for a set of frames, going through the per-directory cache. A table without any
 * usable frame is never written to the cache.
 */
public final class MetricsCollector {
    private static final Logger LOG = LogManager.getLogger(MetricsCollector.class);

    private final MetricExtractor extractor;
    private final MetricsCache cache;

    public MetricsCollector(MetricExtractor extractor, MetricsCache cache) {
        this.extractor = extractor;
        this.cache = cache;
    }

    public Table collect(List<FrameFiles> frames, Path cacheDir, String cacheName, boolean forceRecompute)
            throws IOException {
        if (forceRecompute) {
            cache.invalidate(cacheDir, cacheName);
        } else {
            Optional<List<FrameRecord>> cached = cache.load(cacheDir, cacheName);
            if (cached.isPresent()) {
                if (cached.get().isEmpty()) {
                    LOG.warn("metrics snapshot {} holds no frames; rerun with --recompute-metrics once frames are ready",
                            cache.location(cacheDir, cacheName));
                }
                return new Table(cached.get(), List.of(), true);
            }
        }

        List<FrameRecord> records = new ArrayList<>();
        List<Outcome<FrameRecord>> rejected = new ArrayList<>();
        for (FrameFiles files : frames) {
            Outcome<FrameRecord> outcome = extractor.extract(files);
            if (outcome.success) {
                records.add(outcome.value);
            } else {
                rejected.add(outcome);
            }
        }
        if (!rejected.isEmpty()) {
            LOG.warn("{} of {} frames have no usable metrics and are left out of selection",
                    rejected.size(), frames.size());
        }
        if (records.isEmpty()) {
            LOG.warn("no frame of {} has usable metrics, snapshot {} not written",
                    frames.size(), cache.location(cacheDir, cacheName));
        } else {
            cache.save(cacheDir, cacheName, records);
        }
        return new Table(records, rejected, false);
    }

    public static final class Table {
        public final List<FrameRecord> records;
        public final List<Outcome<FrameRecord>> rejected;
        public final boolean fromCache;

        Table(List<FrameRecord> records, List<Outcome<FrameRecord>> rejected, boolean fromCache) {
            this.records = List.copyOf(records);
            this.rejected = List.copyOf(rejected);
            this.fromCache = fromCache;
        }
    }
}
