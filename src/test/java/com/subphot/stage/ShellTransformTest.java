package com.subphot.stage;

import com.subphot.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellTransformTest {

    @TempDir
    Path dir;

    @Test
    void execute_shouldRunCommandThroughShell() throws Exception {
        ShellTransform transform = new ShellTransform("copy", "printf '%s' {label} > {output}", dir, false);
        Task task = Task.builder()
                .input(dir.resolve("frame.fits"))
                .param("label", "hello")
                .output(dir.resolve("frame.out"))
                .build();

        assertEquals(0, transform.execute(task));
        assertEquals("hello", Files.readString(dir.resolve("frame.out")));
    }

    @Test
    void execute_shouldReturnExitStatus() throws Exception {
        ShellTransform transform = new ShellTransform("fail", "exit 3", dir, true);

        assertEquals(3, transform.execute(Task.builder().input(dir.resolve("x")).output(dir.resolve("y")).build()));
    }

    @Test
    void runnerShouldDeleteOutputOfFailingShellCommand() throws Exception {
        ShellTransform transform = new ShellTransform("partial", "echo partial > {output}; exit 1", dir, false);
        PipelineStageRunner runner = new PipelineStageRunner(Config.fromConfigurationProperties(dir, Map.of()));
        Task task = Task.builder().input(dir.resolve("a.fits")).output(dir.resolve("a.out")).build();

        StageResult result = runner.run("shell", List.of(task), transform, 1, 1);

        assertEquals(1, result.failureCount());
        assertFalse(Files.exists(dir.resolve("a.out")));
    }

    @Test
    void commandFor_shouldExposeInputAndOutput() {
        ShellTransform transform = new ShellTransform("cp", "cp {input} {output}", dir, false);
        Task task = Task.builder().input(Path.of("/in.fits")).output(Path.of("/out.fits")).build();

        assertTrue(transform.commandFor(task).endsWith("/in.fits /out.fits"));
    }
}
