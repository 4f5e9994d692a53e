package com.subphot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single pipeline run's per-stage timings and counts, and renders the end-of-run summary.
 */
public final class RunTelemetry {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String target;
    private final String workDir;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String target, String workDir, Instant startedAt) {
        this.target = blankTo(target, "all");
        this.workDir = blankTo(workDir, ".");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
        this.errorsTotal = 0;
    }

    public synchronized String target() {
        return target;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
    }

    public synchronized void setStepNote(String name, String optionalNote) {
        appendNote(steps.computeIfAbsent(sanitizeStepName(name), StepStat::new), optionalNote);
    }

    public synchronized void incrementErrors(int count) {
        if (count <= 0) {
            return;
        }
        this.errorsTotal += count;
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("target=").append(target).append('\n');
        sb.append("workdir=").append(workDir).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("stages:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d ok=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.elapsedMs = 0L;
            this.itemsIn = 0L;
            this.itemsOut = 0L;
            this.errorCount = 0L;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
