package com.subphot.stage;

import com.subphot.config.Config;
import com.subphot.core.diagnostics.CauseCode;
import com.subphot.core.diagnostics.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模块说明：PipelineStageRunner（class）。
 * 主要职责：在固定大小的工作线程池上把一个外部变换映射到一组单帧任务上，逐任务隔离失败。
 * 成功判定：退出码为 0 且声明的输出存在；其他情况一律失败，并在记录结果前删除残留输出。
 * 使用建议：调用在全部任务完成或失败后才返回（阶段屏障）；只有 InterruptedException 会向外抛出。
 */
public final class PipelineStageRunner {
    private static final Logger LOG = LogManager.getLogger(PipelineStageRunner.class);
    private static final String OWNER = "com.subphot.stage.PipelineStageRunner#run(...)";

    private final Config config;

    public PipelineStageRunner(Config config) {
        this.config = config;
    }

    public StageResult run(String stage, List<Task> tasks, Transform transform) throws InterruptedException {
        return run(
                stage,
                tasks,
                transform,
                config.getInt("pipeline.workers", 16),
                config.getInt("pipeline.max_tasks_per_worker", 1000)
        );
    }

/**
 * 方法说明：run，执行一个阶段的全部任务并汇总结果。
 * 处理流程：任务放入共享队列；每个 WorkerLoop 最多处理 maxTasksPerWorker 个任务后退出，队列非空时提交新的 WorkerLoop；
 * 通过 ExecutorCompletionService 等待全部 WorkerLoop 结束。
 * 维护提示：上限针对单个 WorkerLoop 而非线程，新提交的 WorkerLoop 通常复用同一个池线程；每个任务都是独立的外部进程。
 * 未产生结果的任务记为 NOT_EXECUTED，保证 任务数 == 成功数 + 失败数。
 */
    public StageResult run(
            String stage,
            List<Task> tasks,
            Transform transform,
            int workers,
            int maxTasksPerWorker
    ) throws InterruptedException {
        requireDistinct(tasks);
        if (tasks.isEmpty()) {
            LOG.info("{}: no tasks to run", stage);
            return StageResult.empty(stage);
        }
        int poolSize = Math.max(1, Math.min(workers, tasks.size()));
        int perWorker = Math.max(1, maxTasksPerWorker);
        long startedNanos = System.nanoTime();
        LOG.info("{}: {} tasks on {} workers ({} tasks per worker)", stage, tasks.size(), poolSize, perWorker);

        Queue<Task> pending = new ConcurrentLinkedQueue<>(tasks);
        Map<Path, Outcome<Path>> recorded = new ConcurrentHashMap<>();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                1L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                workerThreads(stage)
        );
        pool.allowCoreThreadTimeOut(true);
        CompletionService<Integer> completion = new ExecutorCompletionService<>(pool);

        int running = 0;
        try {
            for (int i = 0; i < poolSize; i++) {
                completion.submit(new WorkerLoop(stage, pending, recorded, transform, perWorker));
                running++;
            }
            while (running > 0) {
                Future<Integer> future = completion.take();
                running--;
                try {
                    int handled = future.get();
                    LOG.debug("{}: worker retired after {} tasks", stage, handled);
                } catch (ExecutionException e) {
                    LOG.error("{}: worker died: {}", stage, String.valueOf(e.getCause()));
                }
                if (!pending.isEmpty()) {
                    completion.submit(new WorkerLoop(stage, pending, recorded, transform, perWorker));
                    running++;
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            throw e;
        } finally {
            pool.shutdown();
        }

        Map<Path, Outcome<Path>> ordered = new LinkedHashMap<>();
        for (Task task : tasks) {
            Outcome<Path> outcome = recorded.get(task.input);
            if (outcome == null) {
                deletePartialOutputs(task);
                outcome = Outcome.failure(CauseCode.NOT_EXECUTED, OWNER, Map.of("input", task.input.toString()));
            }
            ordered.put(task.input, outcome);
        }
        StageResult result = new StageResult(stage, ordered, (System.nanoTime() - startedNanos) / 1_000_000L);
        if (result.failureCount() > 0) {
            LOG.warn("{}: {} of {} tasks failed", stage, result.failureCount(), result.size());
        } else {
            LOG.info("{}: all {} tasks succeeded in {} ms", stage, result.size(), result.elapsedMs);
        }
        return result;
    }

    static Outcome<Path> runTask(String stage, Task task, Transform transform) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("input", task.input.toString());
        details.put("output", String.valueOf(task.output));
        details.put("transform", transform.name());
        try {
            int exitCode = transform.execute(task);
            if (exitCode != 0) {
                deletePartialOutputs(task);
                details.put("exit_code", exitCode);
                LOG.error("{} failed: {} exited with {}", stage, task.input, exitCode);
                return Outcome.failure(CauseCode.TRANSFORM_FAILED, OWNER, details);
            }
            if (task.output == null || !Files.exists(task.output)) {
                deletePartialOutputs(task);
                LOG.error("{} failed: {} produced no {}", stage, task.input, task.output);
                return Outcome.failure(CauseCode.TRANSFORM_OUTPUT_MISSING, OWNER, details);
            }
            LOG.info("{} OK: {} -> {}", stage, task.input, task.output);
            return Outcome.success(task.output, OWNER);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deletePartialOutputs(task);
            details.put("error", "interrupted");
            return Outcome.failure(CauseCode.TRANSFORM_ERROR, OWNER, details);
        } catch (IOException | RuntimeException e) {
            deletePartialOutputs(task);
            details.put("error", String.valueOf(e.getMessage()));
            LOG.error("{} failed: {} could not run: {}", stage, task.input, e.getMessage());
            return Outcome.failure(CauseCode.TRANSFORM_ERROR, OWNER, details);
        }
    }

    static void deletePartialOutputs(Task task) {
        if (task.output != null) {
            deleteRecursively(task.output);
        }
        for (Path side : task.sideOutputs) {
            deleteRecursively(side);
        }
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try {
            if (Files.isDirectory(path)) {
                Files.walkFileTree(path, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
            } else {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LOG.error("cannot remove partial output {}: {}", path, e.getMessage());
        }
    }

    private static void requireDistinct(List<Task> tasks) {
        Set<Path> inputs = new HashSet<>();
        Set<Path> outputs = new HashSet<>();
        for (Task task : tasks) {
            if (task.input == null) {
                throw new IllegalArgumentException("task without input");
            }
            if (!inputs.add(task.input)) {
                throw new IllegalArgumentException("duplicate task input: " + task.input);
            }
            if (task.output != null && !outputs.add(task.output)) {
                throw new IllegalArgumentException("two tasks declare the same output: " + task.output);
            }
        }
    }

    private static ThreadFactory workerThreads(String stage) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, stage + "-worker-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class WorkerLoop implements Callable<Integer> {
        private final String stage;
        private final Queue<Task> pending;
        private final Map<Path, Outcome<Path>> recorded;
        private final Transform transform;
        private final int maxTasks;

        private WorkerLoop(
                String stage,
                Queue<Task> pending,
                Map<Path, Outcome<Path>> recorded,
                Transform transform,
                int maxTasks
        ) {
            this.stage = stage;
            this.pending = pending;
            this.recorded = recorded;
            this.transform = transform;
            this.maxTasks = maxTasks;
        }

        @Override
        public Integer call() {
            int handled = 0;
            while (handled < maxTasks && !Thread.currentThread().isInterrupted()) {
                Task task = pending.poll();
                if (task == null) {
                    break;
                }
                recorded.put(task.input, runTask(stage, task, transform));
                handled++;
            }
            return handled;
        }
    }
}
