package com.subphot.selection;

import com.subphot.model.FrameRecord;

import java.util.List;

/**
 * Frames chosen by a cascade, the level that produced them, and the size reached at every level tried.
 */
public final class SelectionResult {
    public final List<FrameRecord> frames;
    public final String level;
    public final boolean degraded;
    public final List<String> trace;
    public final int excludedForMissingMetrics;
    public final int rejectedByGate;

    public SelectionResult(
            List<FrameRecord> frames,
            String level,
            boolean degraded,
            List<String> trace,
            int excludedForMissingMetrics,
            int rejectedByGate
    ) {
        this.frames = List.copyOf(frames);
        this.level = level;
        this.degraded = degraded;
        this.trace = List.copyOf(trace);
        this.excludedForMissingMetrics = excludedForMissingMetrics;
        this.rejectedByGate = rejectedByGate;
    }

    public FrameRecord first() {
        return frames.get(0);
    }

    SelectionResult withPoolCounts(int excluded, int rejected) {
        return new SelectionResult(frames, level, degraded, trace, excluded, rejected);
    }
}
