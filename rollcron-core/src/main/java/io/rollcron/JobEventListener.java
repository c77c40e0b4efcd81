package io.rollcron;

import io.rollcron.core.Job;
import io.rollcron.core.JobEvent;
import io.rollcron.core.RunnerConfig;

/**
 * Receives job lifecycle events. Called on the executing thread; implementations must not block for long.
 */
public interface JobEventListener {

    void onEvent(JobEvent event, Job job, RunnerConfig runnerConfig);

    static JobEventListener noop() {
        return (event, job, runnerConfig) -> {
        };
    }
}
