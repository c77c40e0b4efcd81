package io.rollcron.internal.runner;

import io.rollcron.core.Job;
import io.rollcron.core.RunStateView;

import java.time.Instant;

/**
 * Per-job run state. Only ever read or written by the runner's mailbox thread.
 */
final class JobState {
    Job job;
    Instant nextRunAt;
    int running;
    boolean pending;

    JobState(Job job, Instant nextRunAt) {
        this.job = job;
        this.nextRunAt = nextRunAt;
    }

    RunStateView view() {
        return new RunStateView(job.id(), running, pending, nextRunAt);
    }
}
