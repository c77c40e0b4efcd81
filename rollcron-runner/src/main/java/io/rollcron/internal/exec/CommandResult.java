package io.rollcron.internal.exec;

/**
 * Outcome of one attempt of a job command.
 */
public record CommandResult(
        Kind kind,
        int exitCode,
        String stdout,
        String stderr,
        String message
) {
    public enum Kind {
        COMPLETED,
        EXEC_ERROR,
        TIMEOUT
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr) {
        return new CommandResult(Kind.COMPLETED, exitCode, stdout, stderr, null);
    }

    public static CommandResult execError(String message) {
        return new CommandResult(Kind.EXEC_ERROR, -1, "", "", message);
    }

    public static CommandResult timeout(String stdout, String stderr) {
        return new CommandResult(Kind.TIMEOUT, -1, stdout, stderr, null);
    }

    public boolean success() {
        return kind == Kind.COMPLETED && exitCode == 0;
    }

    public String describe() {
        return switch (kind) {
            case COMPLETED -> "exit code " + exitCode;
            case EXEC_ERROR -> "failed to execute: " + message;
            case TIMEOUT -> "timeout";
        };
    }
}
