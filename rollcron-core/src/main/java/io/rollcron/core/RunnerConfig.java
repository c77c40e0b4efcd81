package io.rollcron.core;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Scheduler-wide settings loaded from the {@code runner} section of the config file.
 *
 * @param timezone default zone for job schedules; null means the system default
 * @param env      variables exported to every job
 * @param webhooks endpoints notified about every job
 */
public record RunnerConfig(
        ZoneId timezone,
        Map<String, String> env,
        List<WebhookConfig> webhooks
) {
    public RunnerConfig {
        env = env == null ? Map.of() : Map.copyOf(env);
        webhooks = webhooks == null ? List.of() : List.copyOf(webhooks);
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig(null, Map.of(), List.of());
    }

    public ZoneId effectiveTimezone() {
        return timezone != null ? timezone : ZoneId.systemDefault();
    }
}
