package com.subphot.stage;

import com.subphot.config.Config;
import com.subphot.core.diagnostics.CauseCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineStageRunnerTest {

    @TempDir
    Path dir;

    private final PipelineStageRunner runner = new PipelineStageRunner(Config.fromConfigurationProperties(Path.of("."), Map.of()));

    /**
     * Behaves according to the input file name: ok*, fail*, silent*, boom*.
     */
    private static final Transform BY_NAME = new Transform() {
        @Override
        public String name() {
            return "by-name";
        }

        @Override
        public int execute(Task task) throws IOException {
            String name = task.input.getFileName().toString();
            if (name.startsWith("ok")) {
                Files.writeString(task.output, "done");
                return 0;
            }
            if (name.startsWith("fail")) {
                Files.writeString(task.output, "partial");
                for (Path side : task.sideOutputs) {
                    Files.writeString(side, "partial");
                }
                return 2;
            }
            if (name.startsWith("silent")) {
                return 0;
            }
            throw new IOException("cannot start transform");
        }
    };

    private Task task(String name) {
        return Task.builder().input(dir.resolve(name)).output(dir.resolve(name + ".out")).build();
    }

    @Test
    void run_shouldIsolateFailuresAndAccountForEveryTask() throws Exception {
        List<Task> tasks = List.of(task("ok-1"), task("fail-1"), task("silent-1"), task("boom-1"), task("ok-2"));

        StageResult result = runner.run("test", tasks, BY_NAME, 3, 2);

        assertEquals(5, result.size());
        assertEquals(2, result.successCount());
        assertEquals(3, result.failureCount());
        assertEquals(CauseCode.TRANSFORM_FAILED, result.results.get(dir.resolve("fail-1")).causeCode);
        assertEquals("2", result.results.get(dir.resolve("fail-1")).detail("exit_code"));
        assertEquals(CauseCode.TRANSFORM_OUTPUT_MISSING, result.results.get(dir.resolve("silent-1")).causeCode);
        assertEquals(CauseCode.TRANSFORM_ERROR, result.results.get(dir.resolve("boom-1")).causeCode);
        assertEquals(dir.resolve("ok-2.out"), result.outputs().get(dir.resolve("ok-2")));
        assertEquals(List.of(dir.resolve("ok-1"), dir.resolve("fail-1"), dir.resolve("silent-1"),
                dir.resolve("boom-1"), dir.resolve("ok-2")), new ArrayList<>(result.results.keySet()));
    }

    @Test
    void run_shouldRemovePartialOutputsOfFailedTasks() throws Exception {
        Path side = dir.resolve("fail-1.kernel");
        Task failing = Task.builder()
                .input(dir.resolve("fail-1"))
                .output(dir.resolve("fail-1.out"))
                .sideOutput(side)
                .build();

        StageResult result = runner.run("test", List.of(failing), BY_NAME, 1, 1);

        assertEquals(1, result.failureCount());
        assertFalse(Files.exists(dir.resolve("fail-1.out")));
        assertFalse(Files.exists(side));
    }

    @Test
    void run_shouldRemovePartialOutputDirectories() throws Exception {
        Path outDir = dir.resolve("lightcurves");
        Transform partialDirectory = new Transform() {
            @Override
            public String name() {
                return "partial-dir";
            }

            @Override
            public int execute(Task task) throws IOException {
                Files.createDirectories(task.output.resolve("nested"));
                Files.writeString(task.output.resolve("nested/a.rlc"), "x");
                return 1;
            }
        };

        runner.run("collect", List.of(Task.builder().input(dir.resolve("list")).output(outDir).build()),
                partialDirectory, 1, 1);

        assertFalse(Files.exists(outDir));
    }

    @Test
    void run_shouldRecycleWorkersUntilQueueIsDrained() throws Exception {
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            tasks.add(task("ok-" + i));
        }

        StageResult result = runner.run("test", tasks, BY_NAME, 2, 3);

        assertEquals(25, result.successCount());
        for (Task task : tasks) {
            assertTrue(Files.exists(task.output));
        }
    }

    @Test
    void run_shouldNeverExceedWorkerCount() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        Transform slow = new Transform() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public int execute(Task task) throws IOException, InterruptedException {
                int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                Files.writeString(task.output, "done");
                active.decrementAndGet();
                return 0;
            }
        };
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            tasks.add(task("ok-" + i));
        }

        StageResult result = runner.run("test", tasks, slow, 3, 2);

        assertEquals(12, result.successCount());
        assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
    }

    @Test
    void run_shouldRejectDuplicateInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> runner.run("test", List.of(task("ok-1"), task("ok-1")), BY_NAME, 2, 2));
    }

    @Test
    void run_shouldReturnEmptyResultForNoTasks() throws Exception {
        StageResult result = runner.run("test", List.of(), BY_NAME);

        assertEquals(0, result.size());
        assertEquals(0, result.failureCount());
    }
}
