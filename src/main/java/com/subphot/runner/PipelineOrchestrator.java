package com.subphot.runner;

import com.subphot.catalog.FrameCatalog;
import com.subphot.catalog.FrameNaming;
import com.subphot.config.Config;
import com.subphot.core.RunTelemetry;
import com.subphot.core.diagnostics.Outcome;
import com.subphot.metrics.FrameHeaderReader;
import com.subphot.metrics.MetricExtractor;
import com.subphot.metrics.MetricsCache;
import com.subphot.metrics.MetricsCollector;
import com.subphot.metrics.PhotometryReader;
import com.subphot.model.FrameFiles;
import com.subphot.model.FrameRecord;
import com.subphot.model.FrameState;
import com.subphot.selection.MultiCriteriaSelector;
import com.subphot.selection.SelectionQuorumException;
import com.subphot.selection.SelectionResult;
import com.subphot.stage.PipelineStageRunner;
import com.subphot.stage.StageResult;
import com.subphot.stage.Task;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 模块说明：PipelineOrchestrator（class）。
 * 主要职责：按 配准 → 选参考帧 → 卷积 → 合并 → 参考测光 → 相减 → 差分测光 → 汇总 的顺序驱动各阶段；
 * 每个阶段只为上游产物在磁盘上齐全的帧构建任务，缺产物的帧计数跳过，不重试、不报错。
 * 使用建议：阶段之间是严格屏障；帧状态与参考帧在每个阶段后写回状态文件，文件存在性仍是入口判据。
 * 输出已存在且未开启 pipeline.overwrite 的帧视为已完成，不再构建任务。
 */
public final class PipelineOrchestrator {
    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);
    static final String GRID_FILE = "astromref.reg";
    static final String COMBINED_FILE = "combined-photref.fits";
    static final String IPHOT_LIST_FILE = "iphot-files.list";

    private final Config config;
    private final FrameCatalog catalog;
    private final MetricsCollector metrics;
    private final MultiCriteriaSelector selector;
    private final PipelineStageRunner runner;
    private final TransformProvider transforms;
    private final CcdParameterResolver ccdResolver;
    private final RegistrationGridWriter gridWriter;
    private final RunTelemetry telemetry;

    private final Path fitsDir;
    private final Path sourceListDir;
    private final Path photometryDir;
    private final Path registeredDir;
    private final Path referenceDir;
    private final Path subtractedDir;
    private final Path iphotDir;
    private final Path lightcurveDir;
    private final boolean overwrite;

    private FrameStateStore store;

/**
 * 方法说明：PipelineOrchestrator，负责初始化对象并装配依赖参数。
 * 处理流程：目录、扩展名与开关一次性从配置读取；binaryReader 可以为 null。
 */
    public PipelineOrchestrator(
            Config config,
            FrameHeaderReader headerReader,
            PhotometryReader binaryReader,
            TransformProvider transforms,
            RunTelemetry telemetry
    ) {
        this.config = config;
        this.catalog = new FrameCatalog(config);
        this.metrics = new MetricsCollector(new MetricExtractor(headerReader, binaryReader), new MetricsCache());
        this.selector = new MultiCriteriaSelector(config);
        this.runner = new PipelineStageRunner(config);
        this.transforms = transforms;
        this.ccdResolver = new CcdParameterResolver(config, headerReader);
        this.gridWriter = new RegistrationGridWriter(config);
        this.telemetry = telemetry;

        this.fitsDir = config.getPath("paths.fits_dir");
        this.sourceListDir = config.getPath("paths.srclist_dir", fitsDir);
        this.photometryDir = config.getPath("paths.phot_dir", fitsDir);
        this.registeredDir = config.getPath("paths.registered_dir");
        this.referenceDir = config.getPath("paths.reference_dir");
        this.subtractedDir = config.getPath("paths.subtracted_dir");
        this.iphotDir = config.getPath("paths.iphot_dir");
        this.lightcurveDir = config.getPath("paths.lightcurve_dir");
        this.overwrite = config.getBoolean("pipeline.overwrite", false);
    }

    public List<StageReport> runAll() throws IOException, InterruptedException, SelectionQuorumException {
        open();
        List<StageReport> reports = new ArrayList<>();
        for (StageName stage : StageName.values()) {
            reports.add(runOpened(stage));
        }
        return reports;
    }

    public StageReport runStage(StageName stage) throws IOException, InterruptedException, SelectionQuorumException {
        open();
        return runOpened(stage);
    }

    FrameStateStore store() {
        return store;
    }

    private void open() throws IOException {
        store = FrameStateStore.load(config.getPath("paths.state_file"));
        FrameCatalog.Resolution resolution = catalog.resolve(
                fitsDir, config.getString("paths.fits_glob", "*.fits"), sourceListDir, photometryDir);
        for (FrameFiles files : resolution.frames) {
            store.discover(files.frame);
        }
        store.save();
    }

    private StageReport runOpened(StageName stage) throws IOException, InterruptedException, SelectionQuorumException {
        telemetry.startStep(stage.key());
        StageReport report;
        try {
            report = switch (stage) {
                case REGISTER -> register();
                case SELECT_REFERENCES -> selectReferences();
                case CONVOLVE -> convolveReferences();
                case COMBINE -> combineReferences();
                case REFERENCE_PHOTOMETRY -> referencePhotometry();
                case SUBTRACT -> subtract();
                case DIFFERENTIAL_PHOTOMETRY -> differentialPhotometry();
                case COLLECT -> collect();
            };
        } catch (SelectionQuorumException e) {
            telemetry.endStep(stage.key(), 0, 0, 1, "selection quorum failure");
            throw e;
        } finally {
            store.save();
        }
        telemetry.endStep(stage.key(), report.considered, report.succeeded + report.alreadyDone, report.failed,
                report.summaryNote());
        LOG.info("stage {} finished: {} considered, {} tasks, {} ok, {} failed, {} already done, {} skipped",
                stage.key(), report.considered, report.tasks, report.succeeded, report.failed,
                report.alreadyDone, report.skippedMissingUpstream);
        return report;
    }

    private StageReport register() throws IOException, InterruptedException, SelectionQuorumException {
        List<Path> frames = store.frames();
        Path astromref = selectAstrometricReference(frames);
        FrameFiles reference = companions(astromref);
        gridWriter.write(reference.sourceList, gridFile());
        Files.createDirectories(registeredDir);

        Plan xysdk = plan(frames,
                frame -> Task.builder()
                        .input(frame)
                        .param("srclist", companions(frame).sourceList.toString())
                        .output(FrameNaming.xysdk(registeredDir, frame))
                        .build(),
                frame -> List.of(companions(frame).sourceList));
        StageResult xysdkResult = execute("register/xysdk", xysdk, TransformKind.XYSDK);

        Plan shift = plan(frames,
                frame -> Task.builder()
                        .input(frame)
                        .param("astromref", reference.sourceList.toString())
                        .param("srclist", companions(frame).sourceList.toString())
                        .output(FrameNaming.itrans(registeredDir, frame))
                        .build(),
                frame -> List.of(companions(frame).sourceList, reference.sourceList));
        StageResult shiftResult = execute("register/shift", shift, TransformKind.SHIFT);

        Plan resample = plan(frames,
                frame -> Task.builder()
                        .input(frame)
                        .param("frame", frame.toString())
                        .param("itrans", FrameNaming.itrans(registeredDir, frame).toString())
                        .output(FrameNaming.registered(registeredDir, frame))
                        .build(),
                frame -> List.of(frame, FrameNaming.itrans(registeredDir, frame)));
        StageResult resampleResult = execute("register/resample", resample, TransformKind.REGISTER);

        for (Path frame : frames) {
            if (allExist(List.of(
                    FrameNaming.xysdk(registeredDir, frame),
                    FrameNaming.itrans(registeredDir, frame),
                    FrameNaming.registered(registeredDir, frame)))) {
                store.advance(frame, FrameState.REGISTERED);
            }
        }
        return StageReport.of(StageName.REGISTER, frames.size(), resample.skipped, resample.done.size(),
                List.of(xysdkResult, shiftResult, resampleResult),
                "astromref=" + astromref.getFileName());
    }

    private Path selectAstrometricReference(List<Path> frames) throws IOException, SelectionQuorumException {
        MetricsCollector.Table table = metrics.collect(
                companionsOf(frames),
                fitsDir,
                config.getString("astromref.cache_file", "TM-imagesub-astromref.json"),
                config.getBoolean("metrics.force_recompute", false));
        SelectionResult result = selector.selectAstrometricReference(table.records);
        Path astromref = result.first().frame;
        store.setAstrometricReference(astromref);
        LOG.info("astrometric reference: {} (level {})", astromref, result.level);
        return astromref;
    }

    private StageReport selectReferences() throws IOException, SelectionQuorumException {
        List<Path> known = store.framesAtLeast(FrameState.REGISTERED);
        List<Path> registered = new ArrayList<>();
        for (Path frame : known) {
            if (Files.exists(FrameNaming.registered(registeredDir, frame))) {
                registered.add(frame);
            }
        }
        int skipped = store.frames().size() - registered.size();
        MetricsCollector.Table table = metrics.collect(
                companionsOf(registered),
                fitsDir,
                config.getString("photref.cache_file", "TM-imagesub-photref.json"),
                config.getBoolean("metrics.force_recompute", false));
        Set<Path> eligible = new HashSet<>(registered);
        List<FrameRecord> pool = new ArrayList<>();
        for (FrameRecord record : table.records) {
            if (eligible.contains(record.frame)) {
                pool.add(record);
            }
        }
        SelectionResult result = selector.selectPhotometricReferences(pool);
        List<Path> chosen = new ArrayList<>();
        for (FrameRecord record : result.frames) {
            chosen.add(record.frame);
            store.advance(record.frame, FrameState.REFERENCE_CANDIDATE);
        }
        store.setPhotometricReferences(chosen);
        return StageReport.of(StageName.SELECT_REFERENCES, registered.size(), skipped, 0, List.of(),
                "level=" + result.level + (result.degraded ? " degraded" : "") + " picked=" + chosen.size());
    }

    private StageReport convolveReferences() throws IOException, InterruptedException {
        Optional<Path> astromref = store.astrometricReference();
        List<Path> references = store.photometricReferences();
        if (astromref.isEmpty() || references.isEmpty()) {
            LOG.warn("no references selected yet, nothing to convolve");
            return StageReport.of(StageName.CONVOLVE, 0, references.size(), 0, List.of(), "no references selected");
        }
        Files.createDirectories(referenceDir);
        Path grid = gridFile();
        String kernel = config.getString("convolve.kernel_spec", "b/4;i/4;d=4/4");
        Plan plan = plan(references,
                frame -> Task.builder()
                        .input(frame)
                        .param("target", astromref.get().toString())
                        .param("frame", registered(frame).toString())
                        .param("regfile", grid.toString())
                        .param("kernel", kernel)
                        .output(FrameNaming.convolvedReference(referenceDir, registered(frame)))
                        .build(),
                frame -> List.of(registered(frame), grid, astromref.get()));
        StageResult result = execute(StageName.CONVOLVE.key(), plan, TransformKind.PHOTREF_CONVOLVE);
        advance(plan, result, FrameState.CONVOLVED);
        return StageReport.of(StageName.CONVOLVE, references.size(), plan.skipped, plan.done.size(),
                List.of(result), "");
    }

    private StageReport combineReferences() throws IOException, InterruptedException {
        List<Path> references = store.photometricReferences();
        List<String> convolved = new ArrayList<>();
        for (Path frame : references) {
            Path path = FrameNaming.convolvedReference(referenceDir, registered(frame));
            if (Files.exists(path)) {
                convolved.add(path.toString());
            }
        }
        int skipped = references.size() - convolved.size();
        if (convolved.isEmpty()) {
            LOG.warn("no convolved reference frames on disk, nothing to combine");
            return StageReport.of(StageName.COMBINE, references.size(), skipped, 0, List.of(),
                    "no convolved references");
        }
        Path combined = referenceDir.resolve(COMBINED_FILE);
        if (Files.exists(combined) && !overwrite) {
            store.setCombinedReference(combined);
            return StageReport.of(StageName.COMBINE, references.size(), skipped, 1, List.of(), "");
        }
        Task task = Task.builder()
                .input(combined)
                .param("framelist", String.join(" ", convolved))
                .param("method", config.getString("combine.method", "median"))
                .output(combined)
                .build();
        StageResult result = runner.run(StageName.COMBINE.key(), List.of(task),
                transforms.transformFor(TransformKind.COMBINE));
        if (result.failureCount() == 0) {
            store.setCombinedReference(combined);
        }
        return StageReport.of(StageName.COMBINE, references.size(), skipped, 0, List.of(result),
                "frames=" + convolved.size());
    }

    private StageReport referencePhotometry() throws IOException, InterruptedException {
        Path combined = combinedReference();
        Path sourceList = referenceSourceList();
        if (!Files.exists(combined) || sourceList == null || !Files.exists(sourceList)) {
            LOG.warn("combined reference {} or its source list {} is missing, no reference photometry",
                    combined, sourceList);
            return StageReport.of(StageName.REFERENCE_PHOTOMETRY, 1, 1, 0, List.of(), "missing combined reference");
        }
        Path output = FrameNaming.rawPhotometry(combined);
        if (Files.exists(output) && !overwrite) {
            store.setReferencePhotometry(output);
            return StageReport.of(StageName.REFERENCE_PHOTOMETRY, 1, 0, 1, List.of(), "");
        }
        Outcome<CcdParameters> ccd = ccdResolver.resolve(combined, sourceList.getFileName().toString());
        if (!ccd.success) {
            LOG.error("cannot run reference photometry on {}: {} {}", combined, ccd.causeCode, ccd.details);
            return StageReport.of(StageName.REFERENCE_PHOTOMETRY, 1, 1, 0, List.of(), ccd.causeCode.name());
        }
        Task task = Task.builder()
                .input(combined)
                .param("photref", combined.toString())
                .param("srclist", sourceList.toString())
                .param("idcol", config.getString("photometry.srclist_idcol", "1"))
                .param("xycol", config.getString("photometry.srclist_xycol", "7,8"))
                .param("apertures", config.getString("photometry.apertures"))
                .param("serial", serialOf(sourceList))
                .params(ccd.value.asParams())
                .output(output)
                .build();
        StageResult result = runner.run(StageName.REFERENCE_PHOTOMETRY.key(), List.of(task),
                transforms.transformFor(TransformKind.REFERENCE_PHOTOMETRY));
        if (result.failureCount() == 0) {
            store.setReferencePhotometry(output);
        }
        return StageReport.of(StageName.REFERENCE_PHOTOMETRY, 1, 0, 0, List.of(result), "");
    }

    private StageReport subtract() throws IOException, InterruptedException {
        List<Path> frames = store.framesAtLeast(FrameState.REGISTERED);
        Path combined = combinedReference();
        Path grid = gridFile();
        Files.createDirectories(subtractedDir);
        String kernel = config.getString("convolve.kernel_spec", "b/4;i/4;d=4/4");
        Plan plan = plan(frames,
                frame -> {
                    Path registered = registered(frame);
                    Path kernelOutput = FrameNaming.kernel(subtractedDir, registered);
                    return Task.builder()
                            .input(frame)
                            .param("reference", combined.toString())
                            .param("frame", registered.toString())
                            .param("regfile", grid.toString())
                            .param("kernel", kernel)
                            .param("kernel_output", kernelOutput.toString())
                            .output(FrameNaming.subtracted(subtractedDir, registered))
                            .sideOutput(kernelOutput)
                            .build();
                },
                frame -> List.of(registered(frame), combined, grid));
        StageResult result = execute(StageName.SUBTRACT.key(), plan, TransformKind.SUBTRACT);
        advance(plan, result, FrameState.SUBTRACTED);
        return StageReport.of(StageName.SUBTRACT, frames.size(), plan.skipped, plan.done.size(),
                List.of(result), "");
    }

    private StageReport differentialPhotometry() throws IOException, InterruptedException {
        List<Path> frames = store.framesAtLeast(FrameState.SUBTRACTED);
        Path rawPhotometry = store.referencePhotometry().orElse(FrameNaming.rawPhotometry(combinedReference()));
        Files.createDirectories(iphotDir);
        String disjointRadius = config.getString("photometry.disjoint_radius", "2");
        int[] unresolved = {0};
        Plan plan = plan(frames,
                frame -> {
                    Path subtracted = FrameNaming.subtracted(subtractedDir, registered(frame));
                    Outcome<CcdParameters> ccd = ccdResolver.resolve(subtracted, frame.getFileName().toString());
                    if (!ccd.success) {
                        LOG.warn("skipping {}: {} {}", frame, ccd.causeCode, ccd.details);
                        unresolved[0]++;
                        return null;
                    }
                    return Task.builder()
                            .input(frame)
                            .param("frame", subtracted.toString())
                            .param("rawphot", rawPhotometry.toString())
                            .param("disjoint_radius", disjointRadius)
                            .param("kernel", FrameNaming.kernel(subtractedDir, registered(frame)).toString())
                            .param("itrans", FrameNaming.itrans(registeredDir, frame).toString())
                            .param("xysdk", FrameNaming.xysdk(registeredDir, frame).toString())
                            .params(ccd.value.asParams())
                            .output(FrameNaming.iphot(iphotDir, frame))
                            .build();
                },
                frame -> List.of(
                        FrameNaming.subtracted(subtractedDir, registered(frame)),
                        FrameNaming.kernel(subtractedDir, registered(frame)),
                        FrameNaming.itrans(registeredDir, frame),
                        FrameNaming.xysdk(registeredDir, frame),
                        rawPhotometry));
        StageResult result = execute(StageName.DIFFERENTIAL_PHOTOMETRY.key(), plan, TransformKind.SUBTRACTED_PHOTOMETRY);
        advance(plan, result, FrameState.PHOTOMETRY_EXTRACTED);
        return StageReport.of(StageName.DIFFERENTIAL_PHOTOMETRY, frames.size(), plan.skipped, plan.done.size(),
                List.of(result), unresolved[0] > 0 ? "ccd_unresolved=" + unresolved[0] : "");
    }

/**
 * 方法说明：collect，把尚未汇总的差分测光结果并入光变曲线目录。
 * 处理流程：只为有 .iphot 且状态未到 COLLECTED 的帧写本轮清单；任务输出是本轮的 collected-NNNN.list，
 * 失败时只删除该清单，光变曲线目录保持不动；成功后仅推进清单中的帧。
 * 维护提示：开启 pipeline.overwrite 时所有就绪帧重新汇总。
 */
    private StageReport collect() throws IOException, InterruptedException {
        List<Path> frames = store.framesAtLeast(FrameState.PHOTOMETRY_EXTRACTED);
        List<Path> pending = new ArrayList<>();
        List<String> iphots = new ArrayList<>();
        int collected = 0;
        int skipped = 0;
        for (Path frame : frames) {
            Path iphot = FrameNaming.iphot(iphotDir, frame);
            if (!Files.exists(iphot)) {
                skipped++;
                continue;
            }
            if (!overwrite && store.state(frame).map(state -> state.atLeast(FrameState.COLLECTED)).orElse(false)) {
                collected++;
                continue;
            }
            pending.add(frame);
            iphots.add(iphot.toString());
        }
        if (pending.isEmpty()) {
            if (collected == 0) {
                LOG.warn("no photometry files to collect");
            }
            return StageReport.of(StageName.COLLECT, frames.size(), skipped, collected, List.of(),
                    collected == 0 ? "no photometry" : "");
        }
        Files.createDirectories(iphotDir);
        Files.createDirectories(lightcurveDir);
        Path listFile = iphotDir.resolve(IPHOT_LIST_FILE);
        Files.write(listFile, iphots, StandardCharsets.UTF_8);
        Task task = Task.builder()
                .input(listFile)
                .param("iphotlist", listFile.toString())
                .param("lcdir", lightcurveDir.toString())
                .output(nextCollectManifest())
                .build();
        StageResult result = runner.run(StageName.COLLECT.key(), List.of(task),
                transforms.transformFor(TransformKind.COLLECT));
        if (result.failureCount() == 0) {
            for (Path frame : pending) {
                store.advance(frame, FrameState.COLLECTED);
            }
        }
        return StageReport.of(StageName.COLLECT, frames.size(), skipped, collected, List.of(result),
                "iphot=" + pending.size());
    }

    private Path nextCollectManifest() throws IOException {
        int highest = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(iphotDir, "collected-*.list")) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                String digits = name.substring("collected-".length(), name.length() - ".list".length());
                try {
                    highest = Math.max(highest, Integer.parseInt(digits));
                } catch (NumberFormatException e) {
                    LOG.debug("ignoring unexpected manifest name {}", name);
                }
            }
        }
        return iphotDir.resolve(String.format(Locale.ROOT, "collected-%04d.list", highest + 1));
    }

/**
 * 方法说明：plan，为一组帧构建任务清单。
 * 处理流程：上游产物缺失的帧计入 skipped；输出已存在且未开启覆盖的帧计入 done；taskFor 返回 null 的帧只跳过。
 */
    private Plan plan(List<Path> frames, Function<Path, Task> taskFor, Function<Path, List<Path>> upstreamFor) {
        Plan plan = new Plan();
        for (Path frame : frames) {
            if (!allExist(upstreamFor.apply(frame))) {
                plan.skipped++;
                LOG.debug("{} lacks an upstream artifact, skipped", frame);
                continue;
            }
            Task task = taskFor.apply(frame);
            if (task == null) {
                plan.skipped++;
                continue;
            }
            if (Files.exists(task.output) && !overwrite) {
                plan.done.add(frame);
                continue;
            }
            plan.tasks.add(task);
        }
        return plan;
    }

    private StageResult execute(String label, Plan plan, TransformKind kind) throws InterruptedException {
        if (plan.skipped > 0) {
            LOG.warn("{}: {} frames skipped for a missing upstream artifact", label, plan.skipped);
        }
        if (plan.tasks.isEmpty()) {
            return StageResult.empty(label);
        }
        return runner.run(label, plan.tasks, transforms.transformFor(kind));
    }

    private void advance(Plan plan, StageResult result, FrameState state) {
        for (Path frame : plan.done) {
            store.advance(frame, state);
        }
        for (Path frame : result.outputs().keySet()) {
            store.advance(frame, state);
        }
    }

    private FrameFiles companions(Path frame) {
        return catalog.companionsOf(frame, sourceListDir, photometryDir);
    }

    private List<FrameFiles> companionsOf(List<Path> frames) {
        List<FrameFiles> out = new ArrayList<>(frames.size());
        for (Path frame : frames) {
            out.add(companions(frame));
        }
        return out;
    }

    private Path registered(Path frame) {
        return FrameNaming.registered(registeredDir, frame);
    }

    private Path gridFile() {
        return referenceDir.resolve(GRID_FILE);
    }

    private Path combinedReference() {
        return store.combinedReference().orElse(referenceDir.resolve(COMBINED_FILE));
    }

    private Path referenceSourceList() {
        Path configured = config.getPath("photref.sourcelist", null);
        if (configured != null) {
            return configured;
        }
        return store.astrometricReference().map(frame -> companions(frame).sourceList).orElse(null);
    }

    static String serialOf(Path sourceList) {
        String name = sourceList.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean allExist(List<Path> paths) {
        for (Path path : paths) {
            if (path == null || !Files.exists(path)) {
                return false;
            }
        }
        return true;
    }

    private static final class Plan {
        private final List<Task> tasks = new ArrayList<>();
        private final List<Path> done = new ArrayList<>();
        private int skipped;
    }
}
