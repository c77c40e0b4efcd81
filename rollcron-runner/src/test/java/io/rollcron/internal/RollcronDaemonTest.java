package io.rollcron.internal;

import io.rollcron.JobEventListener;
import io.rollcron.config.ConfigException;
import io.rollcron.config.RollcronProperties;
import io.rollcron.internal.sync.GitCli;
import io.rollcron.internal.sync.SyncException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RollcronDaemonTest {

    @TempDir
    Path root;

    private Path source;
    private Path output;
    private RollcronProperties props;
    private RollcronDaemon daemon;

    @BeforeEach
    void setUp() throws Exception {
        source = Files.createDirectories(root.resolve("jobs"));
        output = Files.createDirectories(root.resolve("out"));
        props = new RollcronProperties();
        props.setSource(source.toString());
        props.setCacheDir(root.resolve("cache"));
        props.setTickInterval(Duration.ofMillis(50));
        props.setPullInterval(Duration.ofMillis(200));
        props.setShutdownTimeout(Duration.ofSeconds(10));
        daemon = new RollcronDaemon(props, new GitCli(), JobEventListener.noop(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        daemon.stop();
    }

    @Test
    void daemonShouldRunJobsInsideTheirMaterializedDirectory() throws Exception {
        Files.writeString(source.resolve("greeting.txt"), "hello from source");
        writeConfig(job("greet", "cat greeting.txt > " + output.resolve("greet.txt")));

        daemon.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> Files.exists(output.resolve("greet.txt")));
        assertThat(Files.readString(output.resolve("greet.txt"))).isEqualTo("hello from source");
        assertThat(daemon.cachePaths().jobDir(daemon.sotPath(), "greet").resolve("greeting.txt")).exists();
    }

    @Test
    void sourceChangesShouldBeHotReloaded() throws Exception {
        writeConfig(job("first", "touch " + output.resolve("first")));
        daemon.start();
        await().atMost(Duration.ofSeconds(10)).until(() -> Files.exists(output.resolve("first")));

        writeConfig(job("first", "touch " + output.resolve("first"))
                + job("second", "touch " + output.resolve("second")));

        await().atMost(Duration.ofSeconds(10)).until(() -> Files.exists(output.resolve("second")));
        assertThat(daemon.runner().getJobIds().get()).containsExactly("first", "second");
    }

    @Test
    void stopShouldRemoveJobDirectories() throws Exception {
        writeConfig(job("tidy", "true"));
        daemon.start();
        Path jobDir = daemon.cachePaths().jobDir(daemon.sotPath(), "tidy");
        assertThat(jobDir).exists();

        daemon.stop();

        assertThat(daemon.isRunning()).isFalse();
        assertThat(jobDir).doesNotExist();
    }

    @Test
    void invalidInitialConfigShouldFailStartup() throws Exception {
        Files.writeString(source.resolve("rollcron.yaml"), "jobs:\n  bad:\n    run: { sh: x }\n");

        assertThatThrownBy(() -> daemon.start()).isInstanceOf(ConfigException.class);
        assertThat(daemon.isRunning()).isFalse();
    }

    @Test
    void missingConfigShouldFailStartup() {
        assertThatThrownBy(() -> daemon.start()).isInstanceOf(ConfigException.class);
    }

    @Test
    void missingSourceShouldFailStartup() {
        props.setSource(root.resolve("nowhere").toString());

        assertThatThrownBy(() -> daemon.start())
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void localLocatorShouldBeCanonicalized() throws Exception {
        Path nested = Files.createDirectories(source.resolve("nested"));

        String resolved = RollcronDaemon.resolveLocator(nested.resolve("..").toString());

        assertThat(resolved).isEqualTo(source.toRealPath().toString());
        assertThat(RollcronDaemon.resolveLocator("https://example.com/jobs.git")).isEqualTo("https://example.com/jobs.git");
    }

    private void writeConfig(String jobs) throws Exception {
        Files.writeString(source.resolve("rollcron.yaml"), "jobs:\n" + jobs);
    }

    private static String job(String id, String command) {
        return "  " + id + ":\n"
                + "    schedule:\n"
                + "      cron: \"* * * * * *\"\n"
                + "    run:\n"
                + "      sh: '" + command + "'\n";
    }
}
