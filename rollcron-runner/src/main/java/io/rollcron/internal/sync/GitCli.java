package io.rollcron.internal.sync;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@code git} executable. Every invocation is bounded by a timeout.
 */
public class GitCli {

    private static final int MAX_ERROR_CHARS = 512;

    private final String executable;
    private final Duration timeout;

    public GitCli() {
        this("git", Duration.ofMinutes(10));
    }

    public GitCli(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    /**
     * Streaming consumer of a command's standard output.
     */
    @FunctionalInterface
    public interface OutputHandler {
        void handle(InputStream stdout) throws IOException;
    }

    /**
     * Run git in {@code dir} and return its trimmed standard output.
     */
    public String run(Path dir, String... args) {
        StringBuilder out = new StringBuilder();
        stream(dir, stdout -> out.append(new String(stdout.readAllBytes(), StandardCharsets.UTF_8)), args);
        return out.toString().trim();
    }

    /**
     * Run git and report only whether it exited with status 0.
     */
    public boolean succeeds(Path dir, String... args) {
        try {
            run(dir, args);
            return true;
        } catch (SyncException e) {
            return false;
        }
    }

    /**
     * Run git in {@code dir}, handing its standard output to {@code handler} while it runs.
     * If the handler throws, the process is killed and the failure is rethrown.
     */
    public void stream(Path dir, OutputHandler handler, String... args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        String display = String.join(" ", command);

        ProcessBuilder pb = new ProcessBuilder(command);
        if (dir != null) {
            pb.directory(dir.toFile());
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SyncException(display + " failed to start: " + e.getMessage(), e);
        }

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> {
            try (InputStream err = process.getErrorStream()) {
                return new String(err.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        // the deadline covers reading stdout too, so a hung git cannot block its caller
        AtomicBoolean expired = new AtomicBoolean(false);
        process.onExit()
                .thenApply(p -> false)
                .completeOnTimeout(true, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenAccept(timedOut -> {
                    if (timedOut) {
                        expired.set(true);
                        kill(process);
                    }
                });

        try {
            try (InputStream stdout = process.getInputStream()) {
                handler.handle(stdout);
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                expired.set(true);
            }
        } catch (IOException e) {
            kill(process);
            if (!expired.get()) {
                throw new SyncException(display + " failed: " + e.getMessage(), e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new SyncException(display + " interrupted", e);
        } catch (RuntimeException e) {
            kill(process);
            if (!expired.get()) {
                throw e;
            }
        }

        if (expired.get()) {
            kill(process);
            throw new SyncException(display + " timed out after " + timeout);
        }
        if (process.exitValue() != 0) {
            throw new SyncException(display + " failed (exit " + process.exitValue() + "): "
                    + truncate(stderr.completeOnTimeout("", 5, TimeUnit.SECONDS).join()));
        }
    }

    // helpers such as git-remote-https inherit stdout, so they must die too
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL" : "/dev/null");
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
