package io.rollcron.core;

import java.time.Instant;

/**
 * Read-only snapshot of a job's run state.
 *
 * @param running   number of executions currently in flight
 * @param pending   whether a queued trigger waits for the in-flight run
 * @param nextRunAt next fire time; null when the schedule has no further occurrence
 */
public record RunStateView(
        String jobId,
        int running,
        boolean pending,
        Instant nextRunAt
) {
}
