package io.rollcron.config;

import io.rollcron.internal.RollcronDaemon;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges daemon start/stop with the Spring container lifecycle.
 */
public class RollcronLifecycle implements SmartLifecycle {
    private final RollcronDaemon daemon;
    private final boolean autoStartup;

    public RollcronLifecycle(RollcronDaemon daemon, boolean autoStartup) {
        this.daemon = daemon;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        daemon.start();
    }

    @Override
    public void stop() {
        daemon.stop();
    }

    @Override
    public boolean isRunning() {
        return daemon.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
