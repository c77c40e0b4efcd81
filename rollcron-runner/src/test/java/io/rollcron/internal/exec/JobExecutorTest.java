package io.rollcron.internal.exec;

import io.rollcron.JobEventListener;
import io.rollcron.core.Job;
import io.rollcron.core.JobEvent;
import io.rollcron.core.RetryConfig;
import io.rollcron.core.RunnerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JobExecutorTest {

    @TempDir
    Path jobDir;

    private ExecutorService workerPool;
    private JobEventListener listener;
    private JobExecutor executor;

    @BeforeEach
    void setUp() {
        workerPool = Executors.newCachedThreadPool();
        listener = mock(JobEventListener.class);
        executor = new JobExecutor(workerPool, listener);
    }

    @AfterEach
    void tearDown() {
        executor.close();
        workerPool.shutdownNow();
    }

    @Test
    void successfulCommandShouldRunOnceAndCaptureOutput() {
        Job job = Job.builder("hello", "echo hello").build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.lastResult().stdout()).isEqualTo("hello\n");
        assertThat(eventTypes(job)).containsExactly(JobEvent.Type.STARTED, JobEvent.Type.SUCCEEDED);
    }

    @Test
    void firstAttemptSuccessShouldNotWaitForRetryDelay() {
        Job job = Job.builder("quick", "true")
                .retry(new RetryConfig(3, Duration.ofSeconds(5)))
                .build();

        long started = System.nanoTime();
        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.success()).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void failureWithoutRetryShouldNotReportExhaustion() {
        Job job = Job.builder("fail", "echo oops >&2; exit 3").build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.lastResult().kind()).isEqualTo(CommandResult.Kind.COMPLETED);
        assertThat(outcome.lastResult().exitCode()).isEqualTo(3);
        assertThat(outcome.lastResult().stderr()).isEqualTo("oops\n");
        assertThat(eventTypes(job)).containsExactly(JobEvent.Type.STARTED, JobEvent.Type.FAILED);
    }

    @Test
    void retryShouldMakeMaxPlusOneAttemptsWithBackoff() {
        Job job = Job.builder("flaky", "exit 1")
                .retry(new RetryConfig(2, Duration.ofMillis(10)))
                .build();

        long started = System.nanoTime();
        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        // 10ms + 20ms of backoff
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(30));
        assertThat(eventTypes(job)).containsExactly(
                JobEvent.Type.STARTED,
                JobEvent.Type.FAILED,
                JobEvent.Type.FAILED,
                JobEvent.Type.FAILED,
                JobEvent.Type.RETRIES_EXHAUSTED);
    }

    @Test
    void retryShouldStopAtFirstSuccess() {
        Job job = Job.builder("second-time", "if [ -f marker ]; then exit 0; else touch marker; exit 1; fi")
                .retry(new RetryConfig(5, Duration.ofMillis(1)))
                .build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(eventTypes(job)).containsExactly(
                JobEvent.Type.STARTED, JobEvent.Type.FAILED, JobEvent.Type.SUCCEEDED);
    }

    @Test
    void timeoutShouldKillTheCommand() {
        Job job = Job.builder("slow", "sleep 10").timeout(Duration.ofSeconds(1)).build();

        long started = System.nanoTime();
        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.lastResult().kind()).isEqualTo(CommandResult.Kind.TIMEOUT);
        assertThat(elapsed).isLessThan(Duration.ofSeconds(8));
    }

    @Test
    void timeoutShouldAlsoKillChildProcesses() {
        Job job = Job.builder("tree", "sleep 10 & sleep 10; wait").timeout(Duration.ofSeconds(1)).build();

        long started = System.nanoTime();
        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(outcome.lastResult().kind()).isEqualTo(CommandResult.Kind.TIMEOUT);
        assertThat(elapsed).isLessThan(Duration.ofSeconds(8));
    }

    @Test
    void environmentShouldLayerRunnerJobAndDotEnv() throws Exception {
        Files.writeString(jobDir.resolve(".env"), "C=dotenv\n");
        RunnerConfig runner = new RunnerConfig(null, Map.of("A", "runner", "B", "runner", "C", "runner"), List.of());
        Job job = Job.builder("env", "echo \"$A $B $C\"")
                .env(Map.of("B", "job", "C", "job"))
                .build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, runner);

        assertThat(outcome.lastResult().stdout()).isEqualTo("runner job dotenv\n");
    }

    @Test
    void workingDirShouldBeResolvedInsideJobDir() throws Exception {
        Path sub = Files.createDirectories(jobDir.resolve("scripts"));
        Job job = Job.builder("pwd", "pwd").workingDir("scripts").build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(outcome.lastResult().stdout().trim()).isEqualTo(sub.toRealPath().toString());
    }

    @Test
    void escapingWorkingDirShouldFallBackToJobDir() throws Exception {
        Job job = Job.builder("pwd", "pwd").workingDir("../..").build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(Path.of(outcome.lastResult().stdout().trim()).toRealPath()).isEqualTo(jobDir.toRealPath());
    }

    @Test
    void failingListenerShouldNotBreakExecution() {
        doThrow(new IllegalStateException("listener down")).when(listener).onEvent(any(), any(), any());
        Job job = Job.builder("hello", "true").build();

        ExecutionOutcome outcome = executor.execute(job, jobDir, RunnerConfig.defaults());

        assertThat(outcome.success()).isTrue();
    }

    @Test
    void launchShouldRunOnTheWorkerPool() throws Exception {
        Job job = Job.builder("async", "true").build();

        ExecutionOutcome outcome = executor.launch(job, jobDir, RunnerConfig.defaults()).get(10, TimeUnit.SECONDS);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.jobId()).isEqualTo("async");
    }

    private List<JobEvent.Type> eventTypes(Job job) {
        ArgumentCaptor<JobEvent> events = ArgumentCaptor.forClass(JobEvent.class);
        verify(listener, atLeastOnce()).onEvent(events.capture(), eq(job), any());
        return events.getAllValues().stream().map(JobEvent::type).toList();
    }
}
