package org.pdsync.sync;

import java.util.List;

import org.pdsync.ConfigurationException;
import org.pdsync.LookupException;
import org.pdsync.config.ConfigChannel;
import org.pdsync.config.ConfigUserGroup;
import org.pdsync.pagerduty.PagerDutyUser;
import org.pdsync.slack.SlackChannel;
import org.pdsync.slack.SlackUser;
import org.pdsync.slack.SlackUserGroup;

/**
 * Maps configured references and PagerDuty users onto the Slack
 * users, user groups and channels known at the start of a run.
 */
public class IdentityResolver {
    private final List<SlackUser> users;
    private final List<SlackUserGroup> userGroups;
    private final List<SlackChannel> channels;

    public IdentityResolver(List<SlackUser> users, List<SlackUserGroup> userGroups, List<SlackChannel> channels) {
        this.users = List.copyOf(users);
        this.userGroups = List.copyOf(userGroups);
        this.channels = List.copyOf(channels);
    }

    /**
     * Exact match on the discriminant that is set: id, else name, else handle.
     *
     * @throws LookupException if no user group matches
     */
    public SlackUserGroup resolveGroup(ConfigUserGroup ref) {
        for (SlackUserGroup userGroup : userGroups) {
            if (ref.hasId()) {
                if (ref.id().equals(userGroup.id())) {
                    return userGroup;
                }
            } else if (ref.hasName()) {
                if (ref.name().equals(userGroup.name())) {
                    return userGroup;
                }
            } else if (ref.hasHandle() && ref.handle().equals(userGroup.handle())) {
                return userGroup;
            }
        }
        throw new LookupException("user group %s not found".formatted(ref));
    }

    /**
     * Match on email address (ignoring case), then on the full name
     * of active users.
     *
     * @throws LookupException if no Slack user matches
     */
    public SlackUser resolveUser(PagerDutyUser pdUser) {
        if (pdUser.email() != null && !pdUser.email().isEmpty()) {
            for (SlackUser user : users) {
                if (pdUser.email().equalsIgnoreCase(user.email())) {
                    return user;
                }
            }
        }
        if (pdUser.name() != null && !pdUser.name().isEmpty()) {
            for (SlackUser user : users) {
                if (!user.deleted() && pdUser.name().equals(user.realName())) {
                    return user;
                }
            }
        }
        throw new LookupException("failed to find Slack user for PD user %s".formatted(pdUser));
    }

    /**
     * Match by ID when an ID is given, else by exact name.
     *
     * @throws ConfigurationException if no channel matches
     */
    public SlackChannel resolveChannel(ConfigChannel ref) {
        for (SlackChannel channel : channels) {
            if (ref.hasId() ? ref.id().equals(channel.id()) : ref.hasName() && ref.name().equals(channel.name())) {
                return channel;
            }
        }
        throw new ConfigurationException("failed to find configured Slack channel %s".formatted(ref));
    }
}
