package io.rollcron.core;

import io.rollcron.utils.CronSchedule;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable job definition read from the config file.
 */
public record Job(

        // identity
        String id,
        String name,

        // scheduling
        CronSchedule schedule,
        ZoneId timezone,

        // execution
        String command,
        Duration timeout,
        Concurrency concurrency,
        RetryConfig retry,
        Duration jitter,
        String workingDir,
        boolean enabled,

        // extras
        Map<String, String> env,
        List<WebhookConfig> webhooks
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);

    public Job {
        Objects.requireNonNull(id, "job id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        name = (name == null || name.isBlank()) ? id : name;
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        concurrency = concurrency == null ? Concurrency.SKIP : concurrency;
        env = env == null ? Map.of() : Map.copyOf(env);
        webhooks = webhooks == null ? List.of() : List.copyOf(webhooks);
    }

    /**
     * Zone used to evaluate the cron schedule: the job's own zone, then the runner's, then the system default.
     */
    public ZoneId effectiveTimezone(RunnerConfig runner) {
        if (timezone != null) {
            return timezone;
        }
        return runner != null ? runner.effectiveTimezone() : ZoneId.systemDefault();
    }

    public int maxAttempts() {
        return retry == null ? 1 : retry.max() + 1;
    }

    public static Builder builder(String id, String command) {
        return new Builder(id, command);
    }

    /**
     * Convenience builder, mostly for programmatic jobs and tests.
     */
    public static final class Builder {
        private final String id;
        private final String command;
        private String name;
        private CronSchedule schedule = CronSchedule.parse("* * * * * *");
        private ZoneId timezone;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Concurrency concurrency = Concurrency.SKIP;
        private RetryConfig retry;
        private Duration jitter;
        private String workingDir;
        private boolean enabled = true;
        private Map<String, String> env = Map.of();
        private List<WebhookConfig> webhooks = List.of();

        private Builder(String id, String command) {
            this.id = id;
            this.command = command;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder schedule(String cron) {
            this.schedule = CronSchedule.parse(cron);
            return this;
        }

        public Builder timezone(ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder concurrency(Concurrency concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder retry(RetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public Builder jitter(Duration jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder workingDir(String workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder webhooks(List<WebhookConfig> webhooks) {
            this.webhooks = webhooks;
            return this;
        }

        public Job build() {
            return new Job(id, name, schedule, timezone, command, timeout, concurrency,
                    retry, jitter, workingDir, enabled, env, webhooks);
        }
    }
}
