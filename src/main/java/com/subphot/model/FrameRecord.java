package com.subphot.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 模块说明：FrameRecord（class）。
 * 主要职责：以帧路径为身份，保存伴随文件路径与已提取的指标；提取完成后不可变。
 */
public final class FrameRecord {
    public final Path frame;
    public final Path sourceList;
    public final Path photometry;
    public final Map<MetricName, MetricValue> metrics;

    public FrameRecord(Path frame, Path sourceList, Path photometry, Map<MetricName, MetricValue> metrics) {
        this.frame = Objects.requireNonNull(frame, "frame");
        this.sourceList = sourceList;
        this.photometry = photometry;
        EnumMap<MetricName, MetricValue> copy = new EnumMap<>(MetricName.class);
        if (metrics != null) {
            for (Map.Entry<MetricName, MetricValue> entry : metrics.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    copy.put(entry.getKey(), entry.getValue());
                }
            }
        }
        this.metrics = Collections.unmodifiableMap(copy);
    }

    public static FrameRecord of(FrameFiles files, Map<MetricName, MetricValue> metrics) {
        return new FrameRecord(files.frame, files.sourceList, files.photometry, metrics);
    }

    public MetricValue metric(MetricName name) {
        MetricValue value = metrics.get(name);
        return value == null ? MetricValue.unavailable() : value;
    }

    /**
     * Metric value, or NaN when the metric is unavailable.
     */
    public double value(MetricName name) {
        return metric(name).value;
    }

    public boolean hasAll(Collection<MetricName> required) {
        for (MetricName name : required) {
            if (!metric(name).computed) {
                return false;
            }
        }
        return true;
    }

    public FrameFiles files() {
        return new FrameFiles(frame, sourceList, photometry);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FrameRecord other)) {
            return false;
        }
        return frame.equals(other.frame)
                && Objects.equals(sourceList, other.sourceList)
                && Objects.equals(photometry, other.photometry)
                && metrics.equals(other.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frame, sourceList, photometry, metrics);
    }

    @Override
    public String toString() {
        return "FrameRecord{" + frame.getFileName() + ", metrics=" + metrics.size() + "}";
    }
}
