package io.rollcron.config;

import io.rollcron.JobEventListener;
import io.rollcron.internal.RollcronDaemon;
import io.rollcron.internal.notify.WebhookNotifier;
import io.rollcron.internal.sync.GitCli;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the rollcron daemon.
 * Active once {@code rollcron.source} is set.
 */
@AutoConfiguration
@ConditionalOnClass(RollcronDaemon.class)
@EnableConfigurationProperties(RollcronProperties.class)
@ConditionalOnProperty(prefix = "rollcron", name = "source")
public class RollcronConfig {

    @Bean
    @ConditionalOnMissingBean
    protected GitCli rollcronGitCli() {
        return new GitCli();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobEventListener rollcronJobEventListener() {
        return new WebhookNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RollcronDaemon rollcronDaemon(RollcronProperties props, GitCli git, JobEventListener listener) {
        return new RollcronDaemon(props, git, listener, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public RollcronLifecycle rollcronLifecycle(RollcronDaemon daemon, RollcronProperties props) {
        return new RollcronLifecycle(daemon, props.isAutoStartup());
    }
}
