package io.rollcron;

import io.rollcron.core.Job;
import io.rollcron.core.ReloadResult;
import io.rollcron.core.RunStateView;
import io.rollcron.core.RunnerConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Main scheduler API.
 *
 * <p>Every operation is delivered as a message and handled one at a time by the runner;
 * the returned future completes once the message has been processed.
 */
public interface Runner {
    void start();

    /**
     * Seed the job registry from the first loaded configuration and materialize each job directory.
     */
    CompletableFuture<Void> initialize(List<Job> jobs);

    /**
     * Replace the job registry. Removed jobs finish their in-flight runs but are never triggered again.
     */
    CompletableFuture<ReloadResult> configUpdate(List<Job> jobs, RunnerConfig runnerConfig);

    /**
     * Refresh the working directory of each job from the given SOT mirror.
     * A failure for one id never prevents the others from being refreshed.
     */
    CompletableFuture<Void> syncRequest(List<String> jobIds, Path sotPath);

    CompletableFuture<List<String>> getJobIds();

    CompletableFuture<Optional<RunStateView>> runState(String jobId);

    /**
     * Fire every job whose next run time has passed.
     */
    CompletableFuture<Void> tick();

    /**
     * Stop triggering and wait for in-flight executions.
     */
    CompletableFuture<Void> gracefulShutdown();
}
