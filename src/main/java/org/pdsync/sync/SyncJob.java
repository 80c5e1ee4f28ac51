package org.pdsync.sync;

import java.util.List;

import org.pdsync.config.ConfigChannel;
import org.pdsync.config.ConfigSchedule;

/**
 * A validated Slack sync, built once from configuration.
 * References to schedules, user groups and the channel are resolved
 * for every run by {@link SlackSyncFactory}.
 *
 * @param name unique name of the sync
 * @param schedules configured schedules and their user groups
 * @param channel channel whose topic is maintained, or null
 * @param topicTemplate parsed topic template, or null
 * @param dryRun compute and log changes without applying them
 * @param pretendUsers escape user ids in the rendered topic
 */
public record SyncJob(
        String name,
        List<ConfigSchedule> schedules,
        ConfigChannel channel,
        TopicTemplate topicTemplate,
        boolean dryRun,
        boolean pretendUsers) {

    public boolean hasChannel() {
        return channel != null;
    }

    public boolean hasTopicTemplate() {
        return topicTemplate != null;
    }
}
