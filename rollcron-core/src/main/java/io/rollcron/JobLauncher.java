package io.rollcron;

import io.rollcron.core.Job;
import io.rollcron.core.RunnerConfig;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Starts one execution unit of a job. The returned future completes when the execution
 * (including all retries) has reached a terminal outcome and never completes exceptionally.
 */
public interface JobLauncher {

    CompletableFuture<?> launch(Job job, Path jobDir, RunnerConfig runnerConfig);
}
