package io.rollcron.internal.exec;

/**
 * Terminal outcome of a job execution after all attempts.
 */
public record ExecutionOutcome(
        String jobId,
        boolean success,
        int attempts,
        CommandResult lastResult
) {
}
