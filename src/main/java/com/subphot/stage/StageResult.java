package com.subphot.stage;

import com.subphot.core.diagnostics.Outcome;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-input results of one stage run, in task order. Every submitted task has exactly one entry.
 */
public final class StageResult {
    public final String stage;
    public final Map<Path, Outcome<Path>> results;
    public final long elapsedMs;

    public StageResult(String stage, Map<Path, Outcome<Path>> results, long elapsedMs) {
        this.stage = stage;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.elapsedMs = elapsedMs;
    }

    public static StageResult empty(String stage) {
        return new StageResult(stage, Map.of(), 0L);
    }

    public int size() {
        return results.size();
    }

    public int successCount() {
        int count = 0;
        for (Outcome<Path> outcome : results.values()) {
            if (outcome.success) {
                count++;
            }
        }
        return count;
    }

    public int failureCount() {
        return results.size() - successCount();
    }

    /**
     * Inputs that succeeded mapped to their outputs.
     */
    public Map<Path, Path> outputs() {
        Map<Path, Path> out = new LinkedHashMap<>();
        for (Map.Entry<Path, Outcome<Path>> entry : results.entrySet()) {
            if (entry.getValue().success) {
                out.put(entry.getKey(), entry.getValue().value);
            }
        }
        return out;
    }

    public List<Path> failedInputs() {
        List<Path> out = new ArrayList<>();
        for (Map.Entry<Path, Outcome<Path>> entry : results.entrySet()) {
            if (!entry.getValue().success) {
                out.add(entry.getKey());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return stage + ": " + successCount() + " ok, " + failureCount() + " failed";
    }
}
