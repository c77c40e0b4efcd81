package io.rollcron.core;

import java.util.List;
import java.util.Objects;

/**
 * Parsed content of the config file: runner settings plus the ordered job list.
 */
public record JobConfig(RunnerConfig runner, List<Job> jobs) {
    public JobConfig {
        runner = runner == null ? RunnerConfig.defaults() : runner;
        jobs = List.copyOf(Objects.requireNonNull(jobs, "jobs must not be null"));
    }

    public List<String> jobIds() {
        return jobs.stream().map(Job::id).toList();
    }
}
