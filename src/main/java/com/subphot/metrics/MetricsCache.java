package com.subphot.metrics;

import com.subphot.model.FrameRecord;
import com.subphot.model.MetricName;
import com.subphot.model.MetricValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：MetricsCache（class）。
 * 主要职责：把一个工作目录下全部帧的指标表序列化为单个 JSON 快照，重复选择时跳过重新计算。
 * 使用建议：快照整体有效或整体无效，不做局部失效；重新计算只能由调用方显式触发（invalidate 或 force）。
 * 仅在并行区之外单线程读写。
 */
public final class MetricsCache {
    private static final Logger LOG = LogManager.getLogger(MetricsCache.class);
    static final int FORMAT_VERSION = 1;

    public Path location(Path directory, String fileName) {
        return directory.resolve(fileName);
    }

    /**
     * Snapshot stored for the directory, or empty when there is none or it cannot be used as a whole.
     */
    public Optional<List<FrameRecord>> load(Path directory, String fileName) {
        Path file = location(directory, fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JSONObject root = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            int version = root.optInt("version", -1);
            if (version != FORMAT_VERSION) {
                LOG.warn("metrics cache {} has format version {}, expected {}; ignoring it", file, version, FORMAT_VERSION);
                return Optional.empty();
            }
            JSONArray frames = root.getJSONArray("frames");
            List<FrameRecord> records = new ArrayList<>(frames.length());
            for (int i = 0; i < frames.length(); i++) {
                records.add(fromJson(frames.getJSONObject(i)));
            }
            LOG.info("loaded metrics for {} frames from {}", records.size(), file);
            return Optional.of(records);
        } catch (IOException | JSONException | IllegalArgumentException e) {
            LOG.warn("metrics cache {} is unreadable, ignoring the whole snapshot: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(Path directory, String fileName, List<FrameRecord> records) throws IOException {
        JSONObject root = new JSONObject();
        root.put("version", FORMAT_VERSION);
        root.put("directory", directory.toAbsolutePath().normalize().toString());
        root.put("saved_at", Instant.now().toString());
        JSONArray frames = new JSONArray();
        for (FrameRecord record : records) {
            frames.put(toJson(record));
        }
        root.put("frames", frames);

        Path file = location(directory, fileName);
        Files.createDirectories(file.toAbsolutePath().getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.info("saved metrics for {} frames to {}", records.size(), file);
    }

    public boolean invalidate(Path directory, String fileName) throws IOException {
        boolean deleted = Files.deleteIfExists(location(directory, fileName));
        if (deleted) {
            LOG.info("metrics cache {} invalidated", location(directory, fileName));
        }
        return deleted;
    }

    private static JSONObject toJson(FrameRecord record) {
        JSONObject out = new JSONObject();
        out.put("frame", record.frame.toString());
        out.put("source_list", String.valueOf(record.sourceList));
        out.put("photometry", String.valueOf(record.photometry));
        JSONObject metrics = new JSONObject();
        for (Map.Entry<MetricName, MetricValue> entry : record.metrics.entrySet()) {
            if (entry.getValue().computed) {
                metrics.put(entry.getKey().key(), entry.getValue().value);
            }
        }
        out.put("metrics", metrics);
        return out;
    }

    private static FrameRecord fromJson(JSONObject in) {
        Map<MetricName, MetricValue> metrics = new EnumMap<>(MetricName.class);
        JSONObject raw = in.getJSONObject("metrics");
        for (String key : raw.keySet()) {
            metrics.put(MetricName.fromKey(key), MetricValue.of(raw.getDouble(key)));
        }
        return new FrameRecord(
                Path.of(in.getString("frame")),
                Path.of(in.getString("source_list")),
                Path.of(in.getString("photometry")),
                metrics
        );
    }
}
