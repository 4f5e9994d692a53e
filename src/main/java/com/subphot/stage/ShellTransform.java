package com.subphot.stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs a command template through {@code /bin/sh -c}. The task's input and output are available as
 * {@code {input}} and {@code {output}} next to the task parameters.
 */
public final class ShellTransform implements Transform {
    private static final Logger LOG = LogManager.getLogger(ShellTransform.class);

    private final String name;
    private final String template;
    private final Path workingDir;
    private final boolean debug;

    public ShellTransform(String name, String template, Path workingDir, boolean debug) {
        this.name = name;
        this.template = template;
        this.workingDir = workingDir;
        this.debug = debug;
    }

    @Override
    public String name() {
        return name;
    }

    public String commandFor(Task task) {
        Map<String, String> values = new HashMap<>(task.params);
        values.putIfAbsent("input", String.valueOf(task.input));
        values.putIfAbsent("output", String.valueOf(task.output));
        return CommandTemplate.expand(template, values);
    }

    @Override
    public int execute(Task task) throws IOException, InterruptedException {
        String command = commandFor(task);
        if (debug) {
            LOG.info("[{}] {}", name, command);
        }
        ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command).redirectErrorStream(true);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        Process process = builder.start();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debug("[{}] {}", name, line);
            }
        }
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }
}
