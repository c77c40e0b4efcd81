package io.rollcron.internal.runner;

import io.rollcron.JobLauncher;
import io.rollcron.Runner;
import io.rollcron.core.Job;
import io.rollcron.core.ReloadResult;
import io.rollcron.core.RunStateView;
import io.rollcron.core.RunnerConfig;
import io.rollcron.internal.sync.CachePaths;
import io.rollcron.internal.sync.DirectoryMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runner is the single-writer coordinator of rollcron.
 *
 * <p>All registry and run-state mutation happens on one mailbox thread ({@code rollcron.runner}) that
 * processes messages strictly in arrival order:
 * <ul>
 *   <li>API calls ({@link #initialize}, {@link #configUpdate}, {@link #syncRequest}, ...)</li>
 *   <li>{@code Tick} messages posted by the ticker thread every {@code tickInterval}</li>
 *   <li>{@code JobFinished} messages posted when an execution unit completes</li>
 * </ul>
 * Execution units run on the {@link JobLauncher}'s threads and never block the mailbox.
 */
public class RunnerActor implements Runner {
    private static final Logger log = LoggerFactory.getLogger(RunnerActor.class);

    private final JobLauncher launcher;
    private final DirectoryMaterializer materializer;
    private final CachePaths cachePaths;
    private final Duration tickInterval;
    private final Clock clock;

    private final LinkedBlockingQueue<Envelope> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean ticking = new AtomicBoolean(false);
    private final AtomicBoolean tickQueued = new AtomicBoolean(false);

    private Thread mailboxThread;
    private Thread tickerThread;

    // mailbox-thread state
    private final Map<String, JobState> registry = new LinkedHashMap<>();
    // removed jobs whose runs are still in flight, so a re-added id keeps counting them
    private final Map<String, JobState> retired = new HashMap<>();
    private final Set<CompletableFuture<?>> inFlight = new HashSet<>();
    private Path sotPath;
    private RunnerConfig runnerConfig;
    private boolean shuttingDown;
    private CompletableFuture<Void> drained;

    private record Envelope(String kind, Runnable body) {
    }

    public RunnerActor(JobLauncher launcher,
                       DirectoryMaterializer materializer,
                       CachePaths cachePaths,
                       Path sotPath,
                       RunnerConfig runnerConfig,
                       Duration tickInterval,
                       Clock clock) {
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
        this.cachePaths = Objects.requireNonNull(cachePaths, "cachePaths must not be null");
        this.sotPath = Objects.requireNonNull(sotPath, "sotPath must not be null");
        this.runnerConfig = runnerConfig == null ? RunnerConfig.defaults() : runnerConfig;
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be a positive duration");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the mailbox and ticker threads. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ticking.set(true);

        mailboxThread = new Thread(this::mailboxLoop);
        mailboxThread.setName("rollcron.runner");
        mailboxThread.setDaemon(true);
        mailboxThread.start();

        tickerThread = new Thread(this::tickerLoop);
        tickerThread.setName("rollcron.ticker");
        tickerThread.setDaemon(true);
        tickerThread.start();
        log.info("Runner started tickInterval={} sot={}", tickInterval, sotPath);
    }

    @Override
    public CompletableFuture<Void> initialize(List<Job> jobs) {
        List<Job> snapshot = List.copyOf(jobs);
        return ask("Initialize", () -> {
            Instant now = clock.instant();
            for (Job job : snapshot) {
                materialize(sotPath, job.id());
                registry.put(job.id(), new JobState(job, nextFire(job, now)));
            }
            log.info("Runner initialized jobs={}", registry.keySet());
            return null;
        });
    }

    @Override
    public CompletableFuture<ReloadResult> configUpdate(List<Job> jobs, RunnerConfig newRunnerConfig) {
        List<Job> snapshot = List.copyOf(jobs);
        RunnerConfig runner = newRunnerConfig == null ? RunnerConfig.defaults() : newRunnerConfig;
        return ask("ConfigUpdate", () -> applyConfig(snapshot, runner));
    }

    @Override
    public CompletableFuture<Void> syncRequest(List<String> jobIds, Path newSotPath) {
        List<String> ids = List.copyOf(jobIds);
        return ask("SyncRequest", () -> {
            sotPath = newSotPath;
            for (String id : ids) {
                materialize(newSotPath, id);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> getJobIds() {
        return ask("GetJobIds", () -> List.copyOf(registry.keySet()));
    }

    @Override
    public CompletableFuture<Optional<RunStateView>> runState(String jobId) {
        return ask("RunState", () -> Optional.ofNullable(registry.get(jobId)).map(JobState::view));
    }

    @Override
    public CompletableFuture<Void> tick() {
        return ask("Tick", () -> {
            onTick();
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> gracefulShutdown() {
        return this.<CompletableFuture<Void>>ask("GracefulShutdown", () -> {
            if (!shuttingDown) {
                shuttingDown = true;
                ticking.set(false);
                if (tickerThread != null) {
                    tickerThread.interrupt();
                }
                registry.values().forEach(s -> s.pending = false);
                drained = new CompletableFuture<>();
                log.info("Runner shutting down; waiting for in-flight runs count={}", inFlight.size());
                completeDrainIfIdle();
            }
            return drained;
        }).thenCompose(f -> f);
    }

    /* ================= message handlers (mailbox thread) ================= */

    private ReloadResult applyConfig(List<Job> jobs, RunnerConfig newRunnerConfig) {
        Instant now = clock.instant();
        RunnerConfig previousRunner = runnerConfig;
        runnerConfig = newRunnerConfig;

        Map<String, JobState> next = new LinkedHashMap<>();
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();

        for (Job job : jobs) {
            JobState state = registry.get(job.id());
            if (state == null) {
                JobState revived = retired.remove(job.id());
                if (revived != null) {
                    revived.job = job;
                    revived.nextRunAt = nextFire(job, now);
                    next.put(job.id(), revived);
                } else {
                    next.put(job.id(), new JobState(job, nextFire(job, now)));
                }
                added.add(job.id());
                continue;
            }

            Job previous = state.job;
            ZoneId oldZone = previous.effectiveTimezone(previousRunner);
            ZoneId newZone = job.effectiveTimezone(newRunnerConfig);
            if (!previous.schedule().equals(job.schedule()) || !oldZone.equals(newZone)
                    || (!previous.enabled() && job.enabled())) {
                state.nextRunAt = job.schedule().nextAfter(now, newZone);
            }
            if (!job.enabled()) {
                state.pending = false;
            }
            state.job = job;
            if (!previous.equals(job)) {
                updated.add(job.id());
            }
            next.put(job.id(), state);
        }

        List<String> removed = new ArrayList<>();
        for (JobState state : registry.values()) {
            if (!next.containsKey(state.job.id())) {
                removed.add(state.job.id());
                state.pending = false;
                if (state.running > 0) {
                    retired.put(state.job.id(), state);
                    log.info("[job:{}] Removed from config; letting {} in-flight run(s) finish", state.job.id(), state.running);
                }
            }
        }

        registry.clear();
        registry.putAll(next);

        ReloadResult result = new ReloadResult(added, removed, updated);
        log.info("Config reloaded added={} removed={} updated={}", added, removed, updated);
        return result;
    }

    private void onTick() {
        tickQueued.set(false);
        if (shuttingDown) {
            return;
        }
        Instant now = clock.instant();
        for (JobState state : registry.values()) {
            if (!state.job.enabled() || state.nextRunAt == null || state.nextRunAt.isAfter(now)) {
                continue;
            }
            state.nextRunAt = nextFire(state.job, now);
            trigger(state);
        }
    }

    private void trigger(JobState state) {
        String id = state.job.id();
        if (state.running == 0) {
            launch(state);
            return;
        }
        switch (state.job.concurrency()) {
            case SKIP -> log.info("[job:{}] Skipped: previous run still in flight", id);
            case QUEUE -> {
                if (state.pending) {
                    log.debug("[job:{}] Trigger coalesced into pending run", id);
                } else {
                    log.info("[job:{}] Queued: previous run still in flight", id);
                }
                state.pending = true;
            }
            case PARALLEL -> launch(state);
        }
    }

    private void launch(JobState state) {
        Job job = state.job;
        Path jobDir = cachePaths.jobDir(sotPath, job.id());
        CompletableFuture<?> run;
        try {
            run = launcher.launch(job, jobDir, runnerConfig);
        } catch (RuntimeException e) {
            log.error("[job:{}] Failed to launch msg={}", job.id(), e.getMessage(), e);
            return;
        }
        state.running++;
        inFlight.add(run);
        run.whenComplete((r, e) -> post(new Envelope("JobFinished", () -> onFinished(state, run, e))));
    }

    private void onFinished(JobState state, CompletableFuture<?> run, Throwable error) {
        inFlight.remove(run);
        state.running--;
        String id = state.job.id();
        if (state.running == 0 && retired.get(id) == state) {
            retired.remove(id);
        }
        if (error != null) {
            log.error("[job:{}] Execution unit failed msg={}", id, error.getMessage(), error);
        }

        if (registry.get(id) == state && state.pending && state.running == 0 && !shuttingDown && state.job.enabled()) {
            state.pending = false;
            log.info("[job:{}] Starting queued run", id);
            launch(state);
        }
        completeDrainIfIdle();
    }

    private void completeDrainIfIdle() {
        if (shuttingDown && inFlight.isEmpty() && drained != null && !drained.isDone()) {
            log.info("Runner stopped; all in-flight runs finished");
            started.set(false);
            drained.complete(null);
        }
    }

    private void materialize(Path sot, String jobId) {
        Path jobDir = cachePaths.jobDir(sot, jobId);
        try {
            materializer.syncToJobDir(sot, jobDir);
            log.debug("[job:{}] Synced working directory dir={}", jobId, jobDir);
        } catch (RuntimeException e) {
            log.error("[job:{}] Failed to sync working directory; keeping previous version msg={}", jobId, e.getMessage(), e);
        }
    }

    private Instant nextFire(Job job, Instant now) {
        return job.schedule().nextAfter(now, job.effectiveTimezone(runnerConfig));
    }

    /* ================= mailbox plumbing ================= */

    private <T> CompletableFuture<T> ask(String kind, Supplier<T> handler) {
        CompletableFuture<T> reply = new CompletableFuture<>();
        if (!started.get()) {
            reply.completeExceptionally(new IllegalStateException("Runner is not running"));
            return reply;
        }
        post(new Envelope(kind, () -> {
            try {
                reply.complete(handler.get());
            } catch (RuntimeException e) {
                log.error("Runner message failed kind={} msg={}", kind, e.getMessage(), e);
                reply.completeExceptionally(e);
            }
        }));
        return reply;
    }

    private void post(Envelope envelope) {
        mailbox.offer(envelope);
    }

    private void mailboxLoop() {
        while (started.get() || !mailbox.isEmpty()) {
            Envelope envelope;
            try {
                envelope = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                envelope.body().run();
            } catch (RuntimeException e) {
                log.error("Runner failed to handle kind={} msg={}", envelope.kind(), e.getMessage(), e);
            }
        }
        log.debug("Runner mailbox closed");
    }

    private void tickerLoop() {
        while (ticking.get()) {
            try {
                Thread.sleep(tickInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (ticking.get() && tickQueued.compareAndSet(false, true)) {
                post(new Envelope("Tick", this::onTick));
            }
        }
    }
}
