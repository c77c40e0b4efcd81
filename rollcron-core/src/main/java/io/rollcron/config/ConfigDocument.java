package io.rollcron.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw shape of {@code rollcron.yaml} as bound by Jackson, before validation.
 */
record ConfigDocument(
        RunnerSection runner,
        LinkedHashMap<String, JobSection> jobs
) {

    record RunnerSection(
            String timezone,
            Map<String, String> env,
            List<WebhookSection> webhook
    ) {
    }

    record WebhookSection(String url) {
    }

    record JobSection(
            String name,
            ScheduleSection schedule,
            RunSection run,
            Map<String, String> env,
            List<WebhookSection> webhook,
            Boolean enabled
    ) {
    }

    record ScheduleSection(String cron, String timezone) {
    }

    record RunSection(
            String sh,
            String timeout,
            String concurrency,
            RetrySection retry,
            @JsonProperty("working_dir") String workingDir,
            String jitter
    ) {
    }

    record RetrySection(Integer max, String delay, String jitter) {
    }
}
