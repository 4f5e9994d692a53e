package com.subphot.runner;

import com.subphot.stage.StageResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * What one orchestrated stage did: how many frames it looked at, how many it skipped for a missing upstream
 * artifact, how many already had their output, and how its tasks went.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class StageReport {
    public final StageName stage;
    public final int considered;
    public final int skippedMissingUpstream;
    public final int alreadyDone;
    public final int tasks;
    public final int succeeded;
    public final int failed;
    public final List<Path> failedInputs;
    public final String note;

    static StageReport of(
            StageName stage,
            int considered,
            int skippedMissingUpstream,
            int alreadyDone,
            List<StageResult> results,
            String note
    ) {
        int tasks = 0;
        int succeeded = 0;
        int failed = 0;
        List<Path> failedInputs = new ArrayList<>();
        for (StageResult result : results) {
            tasks += result.size();
            succeeded += result.successCount();
            failed += result.failureCount();
            failedInputs.addAll(result.failedInputs());
        }
        return new StageReport(stage, considered, skippedMissingUpstream, alreadyDone, tasks, succeeded, failed,
                List.copyOf(failedInputs), note == null ? "" : note);
    }

    public String summaryNote() {
        StringBuilder sb = new StringBuilder();
        sb.append("skipped=").append(skippedMissingUpstream).append(" done=").append(alreadyDone);
        if (!note.isEmpty()) {
            sb.append(' ').append(note);
        }
        return sb.toString();
    }
}
