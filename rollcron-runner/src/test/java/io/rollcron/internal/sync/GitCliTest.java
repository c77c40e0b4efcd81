package io.rollcron.internal.sync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class GitCliTest {

    @TempDir
    Path dir;

    @Test
    void runShouldReturnTrimmedStdout() throws Exception {
        GitCli cli = new GitCli(fakeGit("echo \"  hello $1  \""), Duration.ofSeconds(5));

        assertThat(cli.run(dir, "world")).isEqualTo("hello world");
    }

    @Test
    void nonZeroExitShouldReportStderr() throws Exception {
        GitCli cli = new GitCli(fakeGit("echo 'fatal: not a repo' >&2; exit 128"), Duration.ofSeconds(5));

        assertThatThrownBy(() -> cli.run(dir, "pull"))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("exit 128")
                .hasMessageContaining("fatal: not a repo");
        assertThat(cli.succeeds(dir, "pull")).isFalse();
    }

    @Test
    void hangingCommandShouldBeKilledAtTheTimeout() throws Exception {
        GitCli cli = new GitCli(fakeGit("sleep 8"), Duration.ofSeconds(1));

        long started = System.nanoTime();
        assertThatThrownBy(() -> cli.run(dir, "pull"))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("timed out");
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void hangingStreamShouldBeKilledAtTheTimeout() throws Exception {
        GitCli cli = new GitCli(fakeGit("echo partial; sleep 8"), Duration.ofSeconds(1));

        long started = System.nanoTime();
        assertThatThrownBy(() -> cli.stream(dir, stdout -> stdout.transferTo(OutputStream.nullOutputStream()), "archive"))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("timed out");
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
    }

    private String fakeGit(String body) throws Exception {
        Path script = dir.resolve("fake-git");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }
}
