package io.rollcron.internal.sync;

import io.rollcron.Runner;
import io.rollcron.config.ConfigException;
import io.rollcron.config.ConfigParser;
import io.rollcron.core.JobConfig;
import io.rollcron.core.ReloadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically pulls the source and, when new content arrived, hot-reloads the runner:
 * sync job directories first, then apply the new configuration.
 *
 * <p>Any failure leaves the runner on its previous configuration and working directories.
 */
public class SyncDriver {
    private static final Logger log = LoggerFactory.getLogger(SyncDriver.class);

    private final String source;
    private final String configFile;
    private final Duration pullInterval;
    private final SourceSync sourceSync;
    private final Runner runner;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread thread;

    public SyncDriver(String source, String configFile, Duration pullInterval, SourceSync sourceSync, Runner runner) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.configFile = Objects.requireNonNull(configFile, "configFile must not be null");
        this.pullInterval = Objects.requireNonNull(pullInterval, "pullInterval must not be null");
        if (pullInterval.isZero() || pullInterval.isNegative()) {
            throw new IllegalArgumentException("pullInterval must be a positive duration");
        }
        this.sourceSync = Objects.requireNonNull(sourceSync, "sourceSync must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this::loop);
        thread.setName("rollcron.sync");
        thread.setDaemon(true);
        thread.start();
        log.info("Sync driver started source={} pullInterval={}", source, pullInterval);
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(Duration.ofSeconds(10).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Sync driver stopped");
    }

    /**
     * Run one pull cycle.
     *
     * @return true when new content was detected and a reload was applied
     */
    public boolean syncOnce() {
        SourceSync.Result result;
        try {
            result = sourceSync.ensure(source);
        } catch (SyncException e) {
            log.error("Failed to sync source source={} msg={}", source, e.getMessage());
            return false;
        }
        if (!result.changed()) {
            log.debug("Source unchanged source={}", source);
            return false;
        }

        Path sotPath = result.sotPath();
        log.info("Source changed; reloading config source={}", source);
        JobConfig config;
        try {
            config = ConfigParser.load(sotPath.resolve(configFile));
        } catch (ConfigException e) {
            log.error("Invalid config; keeping previous jobs msg={}", e.getMessage());
            return false;
        }

        try {
            runner.syncRequest(config.jobIds(), sotPath).join();
            ReloadResult reload = runner.configUpdate(config.jobs(), config.runner()).join();
            if (reload.hasEffect()) {
                log.info("Reload applied added={} removed={} updated={}", reload.added(), reload.removed(), reload.updated());
            }
            return true;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to apply reload msg={}", cause.getMessage(), cause);
            return false;
        }
    }

    private void loop() {
        while (started.get()) {
            try {
                Thread.sleep(pullInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!started.get()) {
                return;
            }
            try {
                syncOnce();
            } catch (RuntimeException e) {
                log.error("Sync cycle failed msg={}", e.getMessage(), e);
            }
        }
    }
}
