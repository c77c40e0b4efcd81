package io.rollcron.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the rollcron daemon.
 */
@ConfigurationProperties(prefix = "rollcron")
public class RollcronProperties {
    private String source; // git URL or local path
    private Duration pullInterval = Duration.ofHours(1);
    private Duration tickInterval = Duration.ofMillis(500);
    private Path cacheDir; // null: platform cache directory
    private String configFile = ConfigParser.DEFAULT_FILE_NAME;
    private Duration shutdownTimeout = Duration.ofHours(1);
    private boolean cleanupOnShutdown = true;
    private boolean autoStartup = true;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Duration getPullInterval() {
        return pullInterval;
    }

    public void setPullInterval(Duration pullInterval) {
        this.pullInterval = pullInterval;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isCleanupOnShutdown() {
        return cleanupOnShutdown;
    }

    public void setCleanupOnShutdown(boolean cleanupOnShutdown) {
        this.cleanupOnShutdown = cleanupOnShutdown;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
