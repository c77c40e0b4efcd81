package io.rollcron.cli;

import io.rollcron.config.ConfigException;
import io.rollcron.config.RollcronProperties;
import io.rollcron.internal.RollcronDaemon;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RollcronCommandTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        RollcronCommand command = new RollcronCommand();
        new CommandLine(command).parseArgs("~/jobs");

        RollcronProperties props = command.toProperties();

        assertThat(props.getSource()).isEqualTo("~/jobs");
        assertThat(props.getPullInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(props.getConfigFile()).isEqualTo("rollcron.yaml");
        assertThat(props.getCacheDir()).isNull();
        assertThat(props.getShutdownTimeout()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void optionsShouldBeApplied() {
        RollcronCommand command = new RollcronCommand();
        new CommandLine(command).parseArgs(
                "git@github.com:acme/jobs.git",
                "--pull-interval", "60",
                "--cache-dir", "/var/cache/rollcron",
                "--config", "cron/rollcron.yaml",
                "--shutdown-timeout", "30");

        RollcronProperties props = command.toProperties();

        assertThat(props.getSource()).isEqualTo("git@github.com:acme/jobs.git");
        assertThat(props.getPullInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.getCacheDir()).isEqualTo(Path.of("/var/cache/rollcron"));
        assertThat(props.getConfigFile()).isEqualTo("cron/rollcron.yaml");
        assertThat(props.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void missingRepoShouldBeUsageError() {
        StringWriter err = new StringWriter();
        CommandLine cli = new CommandLine(new RollcronCommand());
        cli.setErr(new PrintWriter(err));

        int code = cli.execute();

        assertThat(code).isEqualTo(2);
        assertThat(err.toString()).contains("REPO");
    }

    @Test
    void nonPositivePullIntervalShouldBeUsageError() {
        StringWriter err = new StringWriter();
        CommandLine cli = new CommandLine(new RollcronCommand(props -> {
            throw new AssertionError("daemon must not be created");
        }));
        cli.setErr(new PrintWriter(err));

        int code = cli.execute("/srv/jobs", "--pull-interval", "0");

        assertThat(code).isEqualTo(2);
        assertThat(err.toString()).contains("--pull-interval");
    }

    @Test
    void startupConfigErrorShouldExitWithOne() {
        StringWriter err = new StringWriter();
        CommandLine cli = new CommandLine(new RollcronCommand(props -> new RollcronDaemon(props) {
            @Override
            public void start() {
                throw new ConfigException("jobs.build.schedule.cron: invalid cron expression");
            }
        }));
        cli.setErr(new PrintWriter(err));

        int code = cli.execute("/srv/jobs");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString()).contains("rollcron: jobs.build.schedule.cron: invalid cron expression");
    }
}
