package io.rollcron.config;

import io.rollcron.core.Concurrency;
import io.rollcron.core.Job;
import io.rollcron.core.JobConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    @Test
    void parseShouldReadFullDocument() {
        JobConfig config = ConfigParser.parse("""
                runner:
                  timezone: Asia/Tokyo
                  env:
                    STAGE: prod
                  webhook:
                    - url: https://hooks.example.com/all
                jobs:
                  backup:
                    name: "Nightly backup"
                    schedule:
                      cron: "0 3 * * *"
                      timezone: UTC
                    run:
                      sh: ./backup.sh --full
                      timeout: 10m
                      concurrency: queue
                      retry:
                        max: 3
                        delay: 2s
                        jitter: 500ms
                      working_dir: scripts
                      jitter: 30s
                    env:
                      TARGET: s3
                  cleanup:
                    schedule:
                      cron: "*/30 * * * * *"
                    run:
                      sh: rm -rf tmp/*
                    enabled: false
                """);

        assertThat(config.runner().timezone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
        assertThat(config.runner().env()).containsEntry("STAGE", "prod");
        assertThat(config.runner().webhooks()).hasSize(1);
        assertThat(config.runner().webhooks().get(0).url()).isEqualTo(URI.create("https://hooks.example.com/all"));
        assertThat(config.jobIds()).containsExactly("backup", "cleanup");

        Job backup = config.jobs().get(0);
        assertThat(backup.name()).isEqualTo("Nightly backup");
        assertThat(backup.timezone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(backup.command()).isEqualTo("./backup.sh --full");
        assertThat(backup.timeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(backup.concurrency()).isEqualTo(Concurrency.QUEUE);
        assertThat(backup.retry().max()).isEqualTo(3);
        assertThat(backup.retry().delay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(backup.retry().jitter()).isEqualTo(Duration.ofMillis(500));
        assertThat(backup.workingDir()).isEqualTo("scripts");
        assertThat(backup.jitter()).isEqualTo(Duration.ofSeconds(30));
        assertThat(backup.env()).containsEntry("TARGET", "s3");
        assertThat(backup.enabled()).isTrue();

        Job cleanup = config.jobs().get(1);
        assertThat(cleanup.name()).isEqualTo("cleanup");
        assertThat(cleanup.timeout()).isEqualTo(Job.DEFAULT_TIMEOUT);
        assertThat(cleanup.concurrency()).isEqualTo(Concurrency.SKIP);
        assertThat(cleanup.retry()).isNull();
        assertThat(cleanup.enabled()).isFalse();
        assertThat(cleanup.effectiveTimezone(config.runner())).isEqualTo(ZoneId.of("Asia/Tokyo"));
    }

    @Test
    void parseShouldAcceptConcurrencyAliases() {
        JobConfig config = ConfigParser.parse("""
                jobs:
                  a:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", concurrency: allow }
                  b:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", concurrency: wait }
                """);

        assertThat(config.jobs()).extracting(Job::concurrency)
                .containsExactly(Concurrency.PARALLEL, Concurrency.QUEUE);
    }

    @Test
    void parseShouldRejectDuplicateJobIds() {
        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  a:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true" }
                  a:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "false" }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Malformed config");
    }

    @Test
    void parseShouldRejectJobIdsThatAreNotPlainDirectoryNames() {
        for (String id : new String[] {"a/../../x", "..", "nested/job", "back\\\\slash"}) {
            assertThatThrownBy(() -> ConfigParser.parse("""
                    jobs:
                      "%s":
                        schedule: { cron: "* * * * *" }
                        run: { sh: "true" }
                    """.formatted(id)))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("Job id");
        }

        JobConfig config = ConfigParser.parse("""
                jobs:
                  nightly.backup_v2-eu:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true" }
                """);
        assertThat(config.jobs()).extracting(Job::id).containsExactly("nightly.backup_v2-eu");
    }

    @Test
    void parseShouldRejectInvalidJobs() {
        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  bad:
                    schedule: { cron: "every minute" }
                    run: { sh: "true" }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("jobs.bad.schedule.cron");

        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  bad:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", timeout: 0s }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("timeout");

        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  bad:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", retry: { max: -1 } }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("retry.max");

        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  bad:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", concurrency: replace }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("concurrency");

        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  bad:
                    schedule: { cron: "* * * * *", timezone: Mars/Olympus }
                    run: { sh: "true" }
                """))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("unknown timezone");
    }

    @Test
    void parseShouldRejectUnknownFields() {
        assertThatThrownBy(() -> ConfigParser.parse("""
                jobs:
                  a:
                    schedule: { cron: "* * * * *" }
                    run: { sh: "true", timout: 5s }
                """))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void loadShouldReportMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigParser.load(dir.resolve(ConfigParser.DEFAULT_FILE_NAME)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Failed to read");
    }

    @Test
    void loadShouldReadFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ConfigParser.DEFAULT_FILE_NAME), """
                jobs:
                  hello:
                    schedule: { cron: "* * * * *" }
                    run: { sh: echo hello }
                """);

        JobConfig config = ConfigParser.load(dir.resolve(ConfigParser.DEFAULT_FILE_NAME));
        assertThat(config.jobIds()).containsExactly("hello");
        assertThat(config.runner().env()).isEmpty();
    }
}
