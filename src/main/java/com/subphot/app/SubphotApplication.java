package com.subphot.app;

import com.subphot.config.Config;
import com.subphot.core.RunTelemetry;
import com.subphot.metrics.FitsHeaderReader;
import com.subphot.runner.PipelineOrchestrator;
import com.subphot.runner.ShellTransformProvider;
import com.subphot.runner.StageName;
import com.subphot.runner.StageReport;
import com.subphot.selection.SelectionQuorumException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：SubphotApplication（class）。
 * 主要职责：命令行入口，解析参数、装配配置与编排器，运行单个阶段或整条流水线并打印运行摘要。
 * 退出码：0 成功，1 意外错误，2 参数错误，3 参考帧选择未达到定额。
 */
public final class SubphotApplication {
    private static final Logger LOG = LogManager.getLogger(SubphotApplication.class);
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_QUORUM = 3;
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

public static void main(String[] args) {
        int exit = new SubphotApplication().run(args);
        System.exit(exit);
    }

public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("subphot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("subphot", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(cmd.getOptionValue("workdir", ".")).toAbsolutePath().normalize();
        if (!Files.isDirectory(workingDir)) {
            System.err.println("ERROR: working directory does not exist: " + workingDir);
            return EXIT_USAGE;
        }
        Map<String, Object> overrides;
        StageName stage;
        try {
            overrides = overridesFrom(cmd);
            String rawStage = cmd.getOptionValue("stage", "all");
            stage = "all".equalsIgnoreCase(rawStage.trim()) ? null : StageName.parse(rawStage);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        Config config = Config.load(workingDir, overrides);
        installLogRoutingIfNeeded(config);
        RunTelemetry telemetry = new RunTelemetry(stage == null ? "all" : stage.key(), workingDir.toString(), Instant.now());
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                config,
                new FitsHeaderReader(),
                null,
                new ShellTransformProvider(config),
                telemetry
        );
        try {
            List<StageReport> reports = stage == null ? orchestrator.runAll() : List.of(orchestrator.runStage(stage));
            int failed = 0;
            for (StageReport report : reports) {
                failed += report.failed;
            }
            if (failed > 0) {
                LOG.warn("{} tasks failed; rerun the stage once their inputs are fixed", failed);
            }
            return EXIT_OK;
        } catch (SelectionQuorumException e) {
            LOG.error("reference selection failed: {}", e.getMessage());
            return EXIT_QUORUM;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("interrupted");
            return EXIT_ERROR;
        } catch (Exception e) {
            LOG.error("pipeline failed", e);
            return EXIT_ERROR;
        } finally {
            telemetry.finish();
            System.out.println(telemetry.getSummary());
        }
    }

    static Map<String, Object> overridesFrom(CommandLine cmd) {
        Map<String, Object> overrides = new LinkedHashMap<>();
        if (cmd.hasOption("workers")) {
            overrides.put("pipeline.workers", positiveInt(cmd, "workers"));
        }
        if (cmd.hasOption("max-tasks-per-worker")) {
            overrides.put("pipeline.max_tasks_per_worker", positiveInt(cmd, "max-tasks-per-worker"));
        }
        if (cmd.hasOption("minframes")) {
            overrides.put("photref.minframes", positiveInt(cmd, "minframes"));
        }
        if (cmd.hasOption("recompute-metrics")) {
            overrides.put("metrics.force_recompute", true);
        }
        if (cmd.hasOption("debug")) {
            overrides.put("app.debug", true);
        }
        return overrides;
    }

    private static int positiveInt(CommandLine cmd, String option) {
        String raw = cmd.getOptionValue(option);
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        throw new IllegalArgumentException("--" + option + " needs a positive integer, got '" + raw + "'");
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (SubphotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("subphot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(SubphotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("log routing enabled, dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("workdir").hasArg().argName("dir").desc("working directory holding config.properties and the frames (default: current directory)").build());
        options.addOption(Option.builder().longOpt("stage").hasArg().argName("name").desc("stage to run: register, select_references, convolve, combine, reference_photometry, subtract, differential_photometry, collect or all (default)").build());
        options.addOption(Option.builder().longOpt("workers").hasArg().argName("n").desc("parallel workers per stage").build());
        options.addOption(Option.builder().longOpt("max-tasks-per-worker").hasArg().argName("n").desc("tasks a worker handles before it is replaced").build());
        options.addOption(Option.builder().longOpt("minframes").hasArg().argName("n").desc("number of photometric reference frames to select").build());
        options.addOption(Option.builder().longOpt("recompute-metrics").desc("ignore and rebuild the frame metrics caches").build());
        options.addOption(Option.builder().longOpt("debug").desc("log every expanded transform command").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
