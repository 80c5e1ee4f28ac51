package org.pdsync.sync;

/**
 * A sync whose schedules, user groups and channel have been resolved
 * for one run.
 *
 * @param name sync name
 * @param schedules resolved schedules with their user groups
 * @param channelId channel whose topic is maintained, or null
 * @param topicTemplate topic template, or null
 * @param dryRun compute and log changes without applying them
 * @param pretendUsers escape user ids in the rendered topic
 */
public record RunSlackSync(
        String name,
        SyncSchedules schedules,
        String channelId,
        TopicTemplate topicTemplate,
        boolean dryRun,
        boolean pretendUsers) {

    public boolean hasChannel() {
        return channelId != null && !channelId.isEmpty();
    }
}
