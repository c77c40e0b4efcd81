package io.rollcron.cli;

import io.rollcron.config.ConfigException;
import io.rollcron.config.ConfigParser;
import io.rollcron.config.RollcronProperties;
import io.rollcron.internal.RollcronDaemon;
import io.rollcron.internal.sync.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

@Command(
        name = "rollcron",
        mixinStandardHelpOptions = true,
        description = "Auto-pulling cron scheduler: runs the jobs of a rollcron.yaml kept in git or a local directory"
)
public class RollcronCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RollcronCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "REPO", description = "Path to a local directory or a git remote (https://... or git@...)")
    String source;

    @Option(names = "--pull-interval", paramLabel = "SECONDS", defaultValue = "3600",
            description = "Pull interval in seconds (default: ${DEFAULT-VALUE})")
    long pullIntervalSeconds;

    @Option(names = "--cache-dir", paramLabel = "DIR", description = "Cache directory (default: platform cache dir)/rollcron")
    Path cacheDir;

    @Option(names = "--config", paramLabel = "FILE", defaultValue = ConfigParser.DEFAULT_FILE_NAME,
            description = "Config file inside the repository (default: ${DEFAULT-VALUE})")
    String configFile;

    @Option(names = "--shutdown-timeout", paramLabel = "SECONDS", defaultValue = "3600",
            description = "Maximum time to wait for running jobs on shutdown (default: ${DEFAULT-VALUE})")
    long shutdownTimeoutSeconds;

    private final Function<RollcronProperties, RollcronDaemon> daemonFactory;

    public RollcronCommand() {
        this(RollcronDaemon::new);
    }

    RollcronCommand(Function<RollcronProperties, RollcronDaemon> daemonFactory) {
        this.daemonFactory = daemonFactory;
    }

    @Override
    public Integer call() throws InterruptedException {
        RollcronProperties props = toProperties();
        RollcronDaemon daemon = daemonFactory.apply(props);
        try {
            daemon.start();
        } catch (ConfigException | SyncException e) {
            log.error("Failed to start msg={}", e.getMessage());
            spec.commandLine().getErr().println("rollcron: " + e.getMessage());
            return 1;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            daemon.stop();
            stopped.countDown();
        }, "rollcron.shutdown"));
        stopped.await();
        return 0;
    }

    RollcronProperties toProperties() {
        if (pullIntervalSeconds <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--pull-interval must be a positive number of seconds");
        }
        if (shutdownTimeoutSeconds <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--shutdown-timeout must be a positive number of seconds");
        }
        RollcronProperties props = new RollcronProperties();
        props.setSource(source);
        props.setPullInterval(Duration.ofSeconds(pullIntervalSeconds));
        props.setCacheDir(cacheDir);
        props.setConfigFile(configFile);
        props.setShutdownTimeout(Duration.ofSeconds(shutdownTimeoutSeconds));
        return props;
    }
}
