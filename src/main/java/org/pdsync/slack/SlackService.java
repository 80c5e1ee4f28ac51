package org.pdsync.slack;

import java.util.List;

import org.pdsync.sync.OncallGroups;

/**
 * Slack operations needed to keep user groups and channel topics in sync.
 * All methods throw {@link SlackException} when Slack reports an error
 * or can not be reached.
 */
public interface SlackService {

    /**
     * @return all users of the workspace
     */
    List<SlackUser> getUsers();

    /**
     * @return all enabled user groups, including their current members
     */
    List<SlackUserGroup> getUserGroups();

    /**
     * @return all public and private channels visible to the bot, excluding archived ones
     */
    List<SlackChannel> getChannels();

    /**
     * Join a channel.
     *
     * @param channelId channel to join
     * @return true if the bot joined, false if it already was a member
     * @throws SlackException if joining failed; see {@link SlackException#isMissingScope()}
     */
    boolean joinChannel(String channelId);

    /**
     * Make each user group contain exactly the given members.
     * Current members are read from Slack for every call; groups that
     * already have the expected members are left untouched.
     *
     * @param groups expected members per user group
     * @param dryRun log the changes without applying them
     */
    void updateOncallGroupMembers(OncallGroups groups, boolean dryRun);

    /**
     * Set the topic of a channel, unless it already has that topic.
     *
     * @param channelId channel to update
     * @param topic new topic
     * @param dryRun log the topic without setting it
     */
    void updateTopic(String channelId, String topic, boolean dryRun);
}
