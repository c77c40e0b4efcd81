package io.rollcron.internal;

import io.rollcron.JobEventListener;
import io.rollcron.config.ConfigParser;
import io.rollcron.config.RollcronProperties;
import io.rollcron.core.JobConfig;
import io.rollcron.internal.exec.JobExecutor;
import io.rollcron.internal.notify.WebhookNotifier;
import io.rollcron.internal.runner.RunnerActor;
import io.rollcron.internal.sync.CachePaths;
import io.rollcron.internal.sync.DirectoryMaterializer;
import io.rollcron.internal.sync.GitCli;
import io.rollcron.internal.sync.SourceSync;
import io.rollcron.internal.sync.SyncDriver;
import io.rollcron.internal.sync.SyncException;
import io.rollcron.utils.ShellExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RollcronDaemon wires the scheduler together and owns its lifecycle.
 *
 * <p>Startup order:
 * <ol>
 *   <li>expand and canonicalize the source locator</li>
 *   <li>bring the SOT mirror up to date</li>
 *   <li>load the config file (errors are fatal at this point)</li>
 *   <li>start the runner, materialize every job directory, start the sync driver</li>
 * </ol>
 *
 * <p>Typical usage:
 * <pre>{@code
 * RollcronDaemon daemon = new RollcronDaemon(props);
 * daemon.start();
 * ...
 * daemon.stop();
 * }</pre>
 */
public class RollcronDaemon {
    private static final Logger log = LoggerFactory.getLogger(RollcronDaemon.class);

    private final RollcronProperties props;
    private final GitCli git;
    private final JobEventListener listener;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private String locator;
    private CachePaths cachePaths;
    private Path sotPath;
    private ExecutorService workerPool;
    private JobExecutor executor;
    private RunnerActor runner;
    private SyncDriver syncDriver;

    public RollcronDaemon(RollcronProperties props) {
        this(props, new GitCli(), new WebhookNotifier(), Clock.systemUTC());
    }

    public RollcronDaemon(RollcronProperties props, GitCli git, JobEventListener listener, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.git = Objects.requireNonNull(git, "git must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the daemon. Should be idempotent.
     *
     * @throws io.rollcron.config.ConfigException when the initial config is missing or invalid
     * @throws SyncException                      when the source cannot be fetched
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            doStart();
        } catch (RuntimeException e) {
            started.set(false);
            if (syncDriver != null) {
                syncDriver.stop();
            }
            if (runner != null) {
                runner.gracefulShutdown();
            }
            releaseThreads();
            throw e;
        }
    }

    private void doStart() {
        String source = Objects.requireNonNull(props.getSource(), "rollcron.source must not be null");
        Duration pullInterval = Objects.requireNonNull(props.getPullInterval(), "rollcron.pullInterval must not be null");
        Duration tickInterval = Objects.requireNonNull(props.getTickInterval(), "rollcron.tickInterval must not be null");

        locator = resolveLocator(source);
        cachePaths = props.getCacheDir() != null ? new CachePaths(props.getCacheDir()) : CachePaths.platformDefault();
        log.info("Rollcron starting source={} cache={} pullInterval={}", locator, cachePaths.base(), pullInterval);

        SourceSync sourceSync = new SourceSync(cachePaths, git);
        sotPath = sourceSync.ensure(locator).sotPath();

        JobConfig config = ConfigParser.load(sotPath.resolve(props.getConfigFile()));
        log.info("Loaded config jobs={}", config.jobIds());

        AtomicInteger seq = new AtomicInteger();
        workerPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("rollcron.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        executor = new JobExecutor(workerPool, listener);

        runner = new RunnerActor(executor, new DirectoryMaterializer(git), cachePaths, sotPath,
                config.runner(), tickInterval, clock);
        runner.start();
        runner.initialize(config.jobs()).join();

        syncDriver = new SyncDriver(locator, props.getConfigFile(), pullInterval, sourceSync, runner);
        syncDriver.start();
        log.info("Rollcron started successfully.");
    }

    /**
     * Stop pulling, wait for in-flight runs (up to {@code shutdownTimeout}) and remove job directories.
     * Should be idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Rollcron stopping...");

        if (syncDriver != null) {
            syncDriver.stop();
        }

        List<String> jobIds = List.of();
        try {
            jobIds = runner.getJobIds().get(10, TimeUnit.SECONDS);
            runner.gracefulShutdown().get(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for running jobs timeout={}", props.getShutdownTimeout());
        } catch (ExecutionException e) {
            log.error("Graceful shutdown failed msg={}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running jobs");
        }

        if (props.isCleanupOnShutdown() && !jobIds.isEmpty()) {
            cachePaths.cleanup(sotPath, jobIds);
            log.info("Cleaned up job directories count={}", jobIds.size());
        }

        releaseThreads();
        log.info("Rollcron stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * The runner, once started. Exposed for diagnostics.
     */
    public RunnerActor runner() {
        return runner;
    }

    public Path sotPath() {
        return sotPath;
    }

    public CachePaths cachePaths() {
        return cachePaths;
    }

    /**
     * Remote locators are used verbatim after expansion; local ones must exist and are made canonical
     * so that the cache name does not depend on the working directory.
     */
    static String resolveLocator(String source) {
        String expanded = ShellExpander.expand(source.trim());
        if (SourceSync.isRemote(expanded)) {
            return expanded;
        }
        Path path = Paths.get(expanded);
        if (!Files.isDirectory(path)) {
            throw new SyncException("Source directory does not exist: " + path);
        }
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            throw new SyncException("Failed to resolve source directory " + path + ": " + e.getMessage(), e);
        }
    }

    private void releaseThreads() {
        if (executor != null) {
            executor.close();
            executor = null;
        }
        if (workerPool != null) {
            workerPool.shutdownNow();
            workerPool = null;
        }
    }
}
