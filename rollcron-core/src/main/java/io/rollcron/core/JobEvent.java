package io.rollcron.core;

import java.time.Instant;

/**
 * Lifecycle event of a job execution.
 */
public record JobEvent(
        Type type,
        String jobId,
        String jobName,
        int attempt,
        String message,
        Instant at
) {
    public enum Type {
        STARTED,
        SUCCEEDED,
        FAILED,
        RETRIES_EXHAUSTED
    }

    public static JobEvent of(Type type, Job job, int attempt, String message) {
        return new JobEvent(type, job.id(), job.name(), attempt, message, Instant.now());
    }
}
