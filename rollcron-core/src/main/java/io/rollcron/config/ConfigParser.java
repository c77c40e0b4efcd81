package io.rollcron.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.rollcron.core.Concurrency;
import io.rollcron.core.Job;
import io.rollcron.core.JobConfig;
import io.rollcron.core.RetryConfig;
import io.rollcron.core.RunnerConfig;
import io.rollcron.core.WebhookConfig;
import io.rollcron.utils.CronSchedule;
import io.rollcron.utils.DurationParser;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses {@code rollcron.yaml} into a validated {@link JobConfig}.
 *
 * <p>Either the whole document is valid or a {@link ConfigException} is thrown; callers never see a
 * partially converted job list.
 */
public final class ConfigParser {

    public static final String DEFAULT_FILE_NAME = "rollcron.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    // ids become directory names under the cache
    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private ConfigParser() {
    }

    public static JobConfig load(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    public static JobConfig parse(String content) {
        ConfigDocument doc;
        try {
            doc = YAML.readValue(content, ConfigDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed config: " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new ConfigException("Config file is empty");
        }

        RunnerConfig runner = toRunnerConfig(doc.runner());
        List<Job> jobs = new ArrayList<>();
        if (doc.jobs() != null) {
            for (Map.Entry<String, ConfigDocument.JobSection> e : doc.jobs().entrySet()) {
                jobs.add(toJob(e.getKey(), e.getValue()));
            }
        }
        return new JobConfig(runner, jobs);
    }

    private static RunnerConfig toRunnerConfig(ConfigDocument.RunnerSection section) {
        if (section == null) {
            return RunnerConfig.defaults();
        }
        return new RunnerConfig(
                zone(section.timezone(), "runner.timezone"),
                section.env(),
                webhooks(section.webhook(), "runner.webhook")
        );
    }

    private static Job toJob(String id, ConfigDocument.JobSection section) {
        String where = "jobs." + id;
        if (id == null || id.isBlank()) {
            throw new ConfigException("Job id must not be blank");
        }
        if (!JOB_ID.matcher(id).matches() || id.equals(".") || id.equals("..")) {
            throw new ConfigException("Job id '" + id + "' may only contain letters, digits, '.', '_' and '-'");
        }
        if (section == null) {
            throw new ConfigException(where + " must not be empty");
        }
        if (section.schedule() == null || isBlank(section.schedule().cron())) {
            throw new ConfigException(where + ".schedule.cron is required");
        }
        ConfigDocument.RunSection run = section.run();
        if (run == null || isBlank(run.sh())) {
            throw new ConfigException(where + ".run.sh is required");
        }

        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(section.schedule().cron());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ".schedule.cron: " + e.getMessage(), e);
        }

        Duration timeout = run.timeout() == null
                ? Job.DEFAULT_TIMEOUT
                : duration(run.timeout(), where + ".run.timeout");

        try {
            return new Job(
                    id,
                    section.name(),
                    schedule,
                    zone(section.schedule().timezone(), where + ".schedule.timezone"),
                    run.sh(),
                    timeout,
                    Concurrency.parse(run.concurrency()),
                    retry(run.retry(), where + ".run.retry"),
                    run.jitter() == null ? null : duration(run.jitter(), where + ".run.jitter"),
                    workingDir(run.workingDir(), where + ".run.working_dir"),
                    section.enabled() == null || section.enabled(),
                    section.env(),
                    webhooks(section.webhook(), where + ".webhook")
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private static RetryConfig retry(ConfigDocument.RetrySection section, String where) {
        if (section == null) {
            return null;
        }
        if (section.max() == null) {
            throw new ConfigException(where + ".max is required");
        }
        if (section.max() < 0) {
            throw new ConfigException(where + ".max must not be negative");
        }
        Duration delay = section.delay() == null ? Duration.ofSeconds(1) : duration(section.delay(), where + ".delay");
        Duration jitter = section.jitter() == null ? null : duration(section.jitter(), where + ".jitter");
        return new RetryConfig(section.max(), delay, jitter);
    }

    private static String workingDir(String value, String where) {
        if (isBlank(value)) {
            return null;
        }
        if (Paths.get(value).isAbsolute()) {
            throw new ConfigException(where + " must be a relative path: " + value);
        }
        return value;
    }

    private static Duration duration(String value, String where) {
        try {
            return DurationParser.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private static ZoneId zone(String value, String where) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (Exception e) {
            throw new ConfigException(where + ": unknown timezone '" + value + "'", e);
        }
    }

    private static List<WebhookConfig> webhooks(List<ConfigDocument.WebhookSection> sections, String where) {
        if (sections == null) {
            return List.of();
        }
        List<WebhookConfig> out = new ArrayList<>();
        for (ConfigDocument.WebhookSection section : sections) {
            if (section == null || isBlank(section.url())) {
                throw new ConfigException(where + ".url is required");
            }
            try {
                URI uri = URI.create(section.url().trim());
                if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                    throw new ConfigException(where + ".url must be an http(s) URL: " + section.url());
                }
                out.add(new WebhookConfig(uri));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(where + ".url is invalid: " + section.url(), e);
            }
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
