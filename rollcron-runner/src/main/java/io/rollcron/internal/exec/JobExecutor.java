package io.rollcron.internal.exec;

import io.rollcron.JobEventListener;
import io.rollcron.JobLauncher;
import io.rollcron.core.Job;
import io.rollcron.core.JobEvent;
import io.rollcron.core.RunnerConfig;
import io.rollcron.utils.Backoff;
import io.rollcron.utils.EnvFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs job commands: startup jitter, working-directory resolution, {@code .env} loading,
 * {@code sh -c} under a hard timeout, and the retry loop with exponential backoff.
 *
 * <p>{@link #execute} never throws. Failures are logged and reported as {@link JobEvent}s.
 */
public class JobExecutor implements JobLauncher {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final ExecutorService workerPool;
    private final ExecutorService outputPool;
    private final JobEventListener listener;

    public JobExecutor(ExecutorService workerPool, JobEventListener listener) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        AtomicInteger seq = new AtomicInteger();
        this.outputPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("rollcron.output-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<ExecutionOutcome> launch(Job job, Path jobDir, RunnerConfig runnerConfig) {
        return CompletableFuture.supplyAsync(() -> execute(job, jobDir, runnerConfig), workerPool);
    }

    public ExecutionOutcome execute(Job job, Path jobDir, RunnerConfig runnerConfig) {
        String id = job.id();
        RunnerConfig runner = runnerConfig == null ? RunnerConfig.defaults() : runnerConfig;

        Duration jitter = Backoff.generateJitter(job.jitter());
        if (!jitter.isZero()) {
            log.info("[job:{}] Applying jitter: {}", id, jitter);
            if (!sleep(jitter)) {
                return interrupted(job, 0);
            }
        }

        Path workDir = WorkDirs.resolve(id, jobDir, job.workingDir());
        int maxAttempts = job.maxAttempts();
        CommandResult result = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                Duration delay = Backoff.calculate(job.retry(), attempt - 1);
                log.info("[job:{}] Retry {}/{} after {}", id, attempt, maxAttempts - 1, delay);
                if (!sleep(delay)) {
                    return interrupted(job, attempt);
                }
            }

            log.info("[job:{}] Starting '{}'", id, job.name());
            log.info("[job:{}]   command: {}", id, job.command());
            if (attempt == 0) {
                emit(JobEvent.of(JobEvent.Type.STARTED, job, 1, null), job, runner);
            }

            result = runCommand(job, workDir, runner);
            report(job, result);

            if (result.success()) {
                emit(JobEvent.of(JobEvent.Type.SUCCEEDED, job, attempt + 1, null), job, runner);
                return new ExecutionOutcome(id, true, attempt + 1, result);
            }

            emit(JobEvent.of(JobEvent.Type.FAILED, job, attempt + 1, result.describe()), job, runner);
            if (attempt + 1 < maxAttempts) {
                log.info("[job:{}] Will retry...", id);
            }
        }

        if (job.retry() != null) {
            log.error("[job:{}] Giving up after {} attempts", id, maxAttempts);
            emit(JobEvent.of(JobEvent.Type.RETRIES_EXHAUSTED, job, maxAttempts, result.describe()), job, runner);
        }
        return new ExecutionOutcome(id, false, maxAttempts, result);
    }

    CommandResult runCommand(Job job, Path workDir, RunnerConfig runner) {
        Map<String, String> dotEnv;
        try {
            dotEnv = EnvFile.load(workDir);
        } catch (IOException e) {
            return CommandResult.execError("Failed to load .env file: " + e.getMessage());
        }

        ProcessBuilder pb = new ProcessBuilder(List.of("sh", "-c", job.command()));
        pb.directory(workDir.toFile());
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        Map<String, String> env = pb.environment();
        env.putAll(runner.env());
        env.putAll(job.env());
        env.putAll(dotEnv);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CommandResult.execError(e.getMessage());
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(job.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                killTree(process);
                return CommandResult.timeout(collect(stdout), collect(stderr));
            }
            return CommandResult.completed(process.exitValue(), collect(stdout), collect(stderr));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killTree(process);
            return CommandResult.execError("interrupted");
        }
    }

    private static void killTree(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, outputPool);
    }

    private static String collect(CompletableFuture<String> output) {
        return output
                .exceptionally(e -> "")
                .completeOnTimeout("", OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)
                .join();
    }

    private static void report(Job job, CommandResult result) {
        String id = job.id();
        switch (result.kind()) {
            case COMPLETED -> {
                if (result.exitCode() == 0) {
                    log.info("[job:{}] ✓ Completed", id);
                    printLines(id, result.stdout(), false);
                } else {
                    log.error("[job:{}] ✗ Failed (exit code: {})", id, result.exitCode());
                    printLines(id, result.stdout(), true);
                    printLines(id, result.stderr(), true);
                }
            }
            case EXEC_ERROR -> log.error("[job:{}] ✗ Failed to execute: {}", id, result.message());
            case TIMEOUT -> {
                log.error("[job:{}] ✗ Timeout after {}", id, job.timeout());
                printLines(id, result.stdout(), true);
                printLines(id, result.stderr(), true);
            }
        }
    }

    private static void printLines(String id, String output, boolean failure) {
        if (output == null || output.isBlank()) {
            return;
        }
        for (String line : output.split("\\R")) {
            if (failure) {
                log.error("[job:{}]   | {}", id, line);
            } else {
                log.info("[job:{}]   | {}", id, line);
            }
        }
    }

    private void emit(JobEvent event, Job job, RunnerConfig runner) {
        try {
            listener.onEvent(event, job, runner);
        } catch (RuntimeException e) {
            log.warn("[job:{}] event listener failed event={} msg={}", event.jobId(), event.type(), e.getMessage(), e);
        }
    }

    private static ExecutionOutcome interrupted(Job job, int attempts) {
        log.warn("[job:{}] Execution interrupted after {} attempts", job.id(), attempts);
        return new ExecutionOutcome(job.id(), false, attempts, CommandResult.execError("interrupted"));
    }

    private static boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops the output reader threads; the worker pool belongs to the caller.
     */
    public void close() {
        outputPool.shutdownNow();
    }
}
