package org.pdsync.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;

import org.pdsync.ConfigurationException;
import org.pdsync.TopicTemplateException;
import org.pdsync.sync.SyncJob;
import org.pdsync.sync.TopicTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import io.quarkus.logging.Log;

/**
 * Builds the list of Slack syncs from the configuration file, or
 * from the single-sync settings when no file is configured.
 * Everything is validated before any sync runs.
 */
@ApplicationScoped
public class SyncConfigLoader {
    static final String ME = "⚙️-config";
    static final String DEFAULT_SYNC_NAME = "default";

    /**
     * YAML mapper for the sync configuration file.
     * <p>
     * Supplier creates the singleton instance when the class is loaded.
     */
    static final ObjectMapper yamlMapper = new Supplier<ObjectMapper>() {
        @Override
        public ObjectMapper get() {
            return new ObjectMapper(new YAMLFactory())
                    .findAndRegisterModules()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        }
    }.get();

    final SyncBotConfig botConfig;

    public SyncConfigLoader(SyncBotConfig botConfig) {
        this.botConfig = botConfig;
    }

    /**
     * Read, override and validate the configuration.
     *
     * @return validated syncs in configuration order
     * @throws ConfigurationException if the configuration is unusable
     */
    public List<SyncJob> loadJobs() {
        return createJobs(generateConfig());
    }

    SyncConfig generateConfig() {
        SyncConfig cfg = botConfig.config().isPresent()
                ? readConfigFile(Path.of(botConfig.config().get()))
                : singleSlackSync();

        // Let globally defined parameters override per-sync ones.
        return cfg.withOverrides(
                botConfig.dryRun().orElse(null),
                botConfig.pretendUsers().orElse(null));
    }

    List<SyncJob> createJobs(SyncConfig cfg) {
        cfg.validate();

        List<SyncJob> jobs = new ArrayList<>();
        for (ConfigSlackSync sync : cfg.slackSyncs()) {
            TopicTemplate template = null;
            if (sync.hasTemplate()) {
                try {
                    template = TopicTemplate.parse(sync.name(), sync.template());
                } catch (TopicTemplateException e) {
                    throw new ConfigurationException("failed to parse %s's template \"%s\": %s"
                            .formatted(sync.name(), sync.template(), e.getMessage()), e);
                }
            } else {
                Log.infof("[%s] Slack sync %s: skipping topic handling because template is undefined",
                        ME, sync.name());
            }
            jobs.add(new SyncJob(sync.name(), sync.schedules(), sync.channel(), template,
                    sync.dryRunEnabled(), sync.pretendUsersEnabled()));
        }
        Log.debugf("[%s] loaded %d slack sync(s)", ME, jobs.size());
        return jobs;
    }

    static SyncConfig readConfigFile(Path file) {
        try {
            SyncConfig cfg = yamlMapper.readValue(file.toFile(), SyncConfig.class);
            return cfg == null ? new SyncConfig(List.of()) : cfg;
        } catch (IOException e) {
            throw new ConfigurationException("failed to read configuration file %s: %s"
                    .formatted(file, e.getMessage()), e);
        }
    }

    SyncConfig singleSlackSync() {
        ConfigChannel channel = null;
        if (botConfig.channelId().isPresent() || botConfig.channelName().isPresent()) {
            channel = new ConfigChannel(
                    botConfig.channelId().orElse(null),
                    botConfig.channelName().orElse(null));
        }

        List<ConfigSchedule> schedules = new ArrayList<>();
        for (String schedule : botConfig.schedules().orElse(List.of())) {
            schedules.add(ScheduleSpecParser.parse(schedule));
        }

        return new SyncConfig(List.of(new ConfigSlackSync(
                DEFAULT_SYNC_NAME,
                schedules,
                channel,
                readTemplate(),
                null,
                null)));
    }

    String readTemplate() {
        if (botConfig.templateFile().isPresent()) {
            Path file = Path.of(botConfig.templateFile().get());
            try {
                return Files.readString(file);
            } catch (IOException e) {
                throw new ConfigurationException("failed to read template file %s: %s"
                        .formatted(file, e.getMessage()), e);
            }
        }
        return botConfig.template().orElse(null);
    }
}
