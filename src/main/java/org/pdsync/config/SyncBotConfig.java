package org.pdsync.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

// Specified in application.yaml, system properties or environment variables
@ConfigMapping(prefix = "pdsync")
public interface SyncBotConfig {

    PagerDutyConfig pagerduty();

    SlackConfig slack();

    /**
     * Path to a YAML file defining one or more Slack syncs.
     * When absent, a single sync named "default" is built from
     * {@link #schedules()}, the channel and the template settings.
     */
    Optional<String> config();

    /**
     * Schedule specifiers for the single sync, e.g.
     * {@code id=P123;userGroup=handle=oncall}
     */
    Optional<List<String>> schedules();

    Optional<String> channelId();

    Optional<String> channelName();

    /** Topic template for the single sync (Qute syntax) */
    Optional<String> template();

    /** File containing the topic template; wins over {@link #template()} */
    Optional<String> templateFile();

    /** When set, overrides the dry-run flag of every sync */
    Optional<Boolean> dryRun();

    /** When set, overrides the pretend-users flag of every sync */
    Optional<Boolean> pretendUsers();

    /** Abort the run on the first failing sync */
    @WithDefault("false")
    boolean failFast();

    DaemonConfig daemon();

    default String display() {
        return """
                config=%s
                dryRun=%s
                pretendUsers=%s
                failFast=%s
                daemon.enabled=%s
                daemon.updateFrequency=%s
                pagerduty.url=%s
                slack.url=%s
                """.formatted(
                config().orElse("N/A"),
                dryRun().map(String::valueOf).orElse("per sync"),
                pretendUsers().map(String::valueOf).orElse("per sync"),
                failFast(),
                daemon().enabled(),
                daemon().updateFrequency(),
                pagerduty().url(),
                slack().url());
    }

    interface PagerDutyConfig {
        @WithDefault("https://api.pagerduty.com")
        String url();

        String token();
    }

    interface SlackConfig {
        @WithDefault("https://slack.com/api")
        String url();

        String token();
    }

    interface DaemonConfig {
        @WithDefault("false")
        boolean enabled();

        /**
         * The period between successive sync runs
         */
        @WithDefault("1m")
        Duration updateFrequency();
    }
}
