package com.subphot.app;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubphotApplicationTest {

    @TempDir
    Path dir;

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(SubphotApplication.buildOptions(), args);
    }

    @Test
    void overridesShouldMapOptionsToConfigKeys() throws Exception {
        Map<String, Object> overrides = SubphotApplication.overridesFrom(parse(
                "--workers", "4", "--max-tasks-per-worker", "50", "--minframes", "20", "--recompute-metrics"));

        assertEquals(4, overrides.get("pipeline.workers"));
        assertEquals(50, overrides.get("pipeline.max_tasks_per_worker"));
        assertEquals(20, overrides.get("photref.minframes"));
        assertEquals(true, overrides.get("metrics.force_recompute"));
        assertEquals(4, overrides.size());
    }

    @Test
    void overridesShouldBeEmptyWithoutOptions() throws Exception {
        assertTrue(SubphotApplication.overridesFrom(parse()).isEmpty());
    }

    @Test
    void overridesShouldRejectNonPositiveWorkers() {
        assertThrows(IllegalArgumentException.class, () -> SubphotApplication.overridesFrom(parse("--workers", "0")));
        assertThrows(IllegalArgumentException.class, () -> SubphotApplication.overridesFrom(parse("--workers", "x")));
    }

    @Test
    void runShouldPrintHelpAndSucceed() {
        assertEquals(SubphotApplication.EXIT_OK, new SubphotApplication().run(new String[]{"--help"}));
    }

    @Test
    void runShouldRejectUnknownOption() {
        assertEquals(SubphotApplication.EXIT_USAGE, new SubphotApplication().run(new String[]{"--bogus"}));
    }

    @Test
    void runShouldRejectUnknownStage() {
        int exit = new SubphotApplication().run(new String[]{"--workdir", dir.toString(), "--stage", "calibrate"});

        assertEquals(SubphotApplication.EXIT_USAGE, exit);
    }

    @Test
    void runShouldRejectMissingWorkingDirectory() {
        int exit = new SubphotApplication().run(new String[]{"--workdir", dir.resolve("absent").toString()});

        assertEquals(SubphotApplication.EXIT_USAGE, exit);
    }

    @Test
    void runShouldRejectBadWorkerCount() {
        int exit = new SubphotApplication().run(new String[]{"--workdir", dir.toString(), "--workers", "-2"});

        assertEquals(SubphotApplication.EXIT_USAGE, exit);
    }
}
