package com.subphot.runner;

import com.subphot.model.FrameState;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 模块说明：FrameStateStore（class）。
 * 主要职责：保存每帧的流水线状态与已选参考帧，持久化为工作目录下的 JSON 文件。
 * 使用建议：只在阶段之间单线程读写；状态只能前进，文件存在性仍是阶段入口的最终判据。
 */
public final class FrameStateStore {
    private static final Logger LOG = LogManager.getLogger(FrameStateStore.class);
    private static final int FORMAT_VERSION = 1;

    private final Path file;
    private final Map<Path, Entry> frames = new TreeMap<>();
    private Path astrometricReference;
    private final List<Path> photometricReferences = new ArrayList<>();
    private Path combinedReference;
    private Path referencePhotometry;

    private FrameStateStore(Path file) {
        this.file = file;
    }

    public static FrameStateStore load(Path file) throws IOException {
        FrameStateStore store = new FrameStateStore(file);
        if (!Files.isRegularFile(file)) {
            return store;
        }
        try {
            JSONObject root = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            JSONObject frameStates = root.optJSONObject("frames");
            if (frameStates != null) {
                for (String key : frameStates.keySet()) {
                    JSONObject entry = frameStates.getJSONObject(key);
                    store.frames.put(Path.of(key), new Entry(
                            FrameState.parse(entry.optString("state"), FrameState.DISCOVERED),
                            entry.optString("updated_at", "")
                    ));
                }
            }
            JSONObject refs = root.optJSONObject("references");
            if (refs != null) {
                store.astrometricReference = optPath(refs, "astrometric");
                store.combinedReference = optPath(refs, "combined");
                store.referencePhotometry = optPath(refs, "raw_photometry");
                JSONArray photometric = refs.optJSONArray("photometric");
                if (photometric != null) {
                    for (int i = 0; i < photometric.length(); i++) {
                        store.photometricReferences.add(Path.of(photometric.getString(i)));
                    }
                }
            }
        } catch (JSONException e) {
            throw new IOException("corrupt pipeline state file " + file + ": " + e.getMessage(), e);
        }
        LOG.info("loaded state of {} frames from {}", store.frames.size(), file);
        return store;
    }

    public Path file() {
        return file;
    }

    /**
     * Registers a frame as DISCOVERED unless it is already known.
     */
    public void discover(Path frame) {
        frames.putIfAbsent(frame, new Entry(FrameState.DISCOVERED, Instant.now().toString()));
    }

    public boolean contains(Path frame) {
        return frames.containsKey(frame);
    }

    public Optional<FrameState> state(Path frame) {
        Entry entry = frames.get(frame);
        return entry == null ? Optional.empty() : Optional.of(entry.state);
    }

    /**
     * Moves the frame forward to {@code target}; a move backwards is ignored.
     *
     * @return true when the stored state changed
     */
    public boolean advance(Path frame, FrameState target) {
        Entry current = frames.get(frame);
        if (current != null && current.state.atLeast(target)) {
            return false;
        }
        frames.put(frame, new Entry(target, Instant.now().toString()));
        return true;
    }

    public List<Path> frames() {
        return List.copyOf(frames.keySet());
    }

    public List<Path> framesAtLeast(FrameState minimum) {
        List<Path> out = new ArrayList<>();
        for (Map.Entry<Path, Entry> entry : frames.entrySet()) {
            if (entry.getValue().state.atLeast(minimum)) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    public Optional<Path> astrometricReference() {
        return Optional.ofNullable(astrometricReference);
    }

    public void setAstrometricReference(Path frame) {
        this.astrometricReference = frame;
    }

    public List<Path> photometricReferences() {
        return List.copyOf(photometricReferences);
    }

    public void setPhotometricReferences(List<Path> frames) {
        photometricReferences.clear();
        photometricReferences.addAll(frames);
    }

    public Optional<Path> combinedReference() {
        return Optional.ofNullable(combinedReference);
    }

    public void setCombinedReference(Path combined) {
        this.combinedReference = combined;
    }

    public Optional<Path> referencePhotometry() {
        return Optional.ofNullable(referencePhotometry);
    }

    public void setReferencePhotometry(Path rawPhotometry) {
        this.referencePhotometry = rawPhotometry;
    }

    public void save() throws IOException {
        JSONObject frameStates = new JSONObject();
        for (Map.Entry<Path, Entry> entry : frames.entrySet()) {
            frameStates.put(entry.getKey().toString(), new JSONObject()
                    .put("state", entry.getValue().state.name())
                    .put("updated_at", entry.getValue().updatedAt));
        }
        JSONObject refs = new JSONObject();
        if (astrometricReference != null) {
            refs.put("astrometric", astrometricReference.toString());
        }
        JSONArray photometric = new JSONArray();
        for (Path path : photometricReferences) {
            photometric.put(path.toString());
        }
        refs.put("photometric", photometric);
        if (combinedReference != null) {
            refs.put("combined", combinedReference.toString());
        }
        if (referencePhotometry != null) {
            refs.put("raw_photometry", referencePhotometry.toString());
        }
        JSONObject root = new JSONObject()
                .put("version", FORMAT_VERSION)
                .put("frames", frameStates)
                .put("references", refs);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.debug("saved state of {} frames to {}", frames.size(), file);
    }

    private static Path optPath(JSONObject obj, String key) {
        String value = obj.optString(key, "");
        return value.isEmpty() ? null : Path.of(value);
    }

    private static final class Entry {
        private final FrameState state;
        private final String updatedAt;

        private Entry(FrameState state, String updatedAt) {
            this.state = state;
            this.updatedAt = updatedAt;
        }
    }
}
