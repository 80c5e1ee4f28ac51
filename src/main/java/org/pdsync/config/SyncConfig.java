package org.pdsync.config;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.pdsync.ConfigurationException;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Root of the sync configuration file.
 *
 * <pre>
 * slackSyncs:
 *   - name: primary
 *     schedules:
 *       - id: P123
 *         userGroups:
 *           - handle: oncall
 * </pre>
 */
@RegisterForReflection
public record SyncConfig(List<ConfigSlackSync> slackSyncs) {

    @Override
    public List<ConfigSlackSync> slackSyncs() {
        return slackSyncs == null ? List.of() : slackSyncs;
    }

    public SyncConfig withOverrides(Boolean dryRun, Boolean pretendUsers) {
        return new SyncConfig(slackSyncs().stream()
                .map(s -> s.withOverrides(dryRun, pretendUsers))
                .toList());
    }

    /**
     * Check the configuration for internal consistency.
     * References are not resolved here.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate() {
        Set<String> foundNames = new HashSet<>();
        for (ConfigSlackSync sync : slackSyncs()) {
            if (!foundNames.add(sync.name())) {
                throw new ConfigurationException("slack sync name \"%s\" already used".formatted(sync.name()));
            }

            for (ConfigSchedule schedule : sync.schedules()) {
                if (!schedule.hasId() && !schedule.hasName()) {
                    throw new ConfigurationException(
                            "slack sync \"%s\" invalid: must specify either schedule ID or schedule name"
                                    .formatted(sync.name()));
                }
                if (schedule.hasId() && schedule.hasName()) {
                    throw new ConfigurationException(
                            "slack sync \"%s\" schedule %s invalid: must not specify both schedule ID and schedule name"
                                    .formatted(sync.name(), schedule));
                }
                for (ConfigUserGroup userGroup : schedule.userGroups()) {
                    if (userGroup.discriminants() != 1) {
                        throw new ConfigurationException(
                                "slack sync \"%s\" user group %s invalid: must specify exactly one of user group ID, user group name or user group handle"
                                        .formatted(sync.name(), userGroup));
                    }
                }
            }

            boolean channelGiven = sync.channel() != null;
            if (channelGiven && !sync.channel().hasId() && !sync.channel().hasName()) {
                throw new ConfigurationException(
                        "slack sync \"%s\" invalid: channel must specify either channel ID or channel name"
                                .formatted(sync.name()));
            }
            if (sync.hasTemplate()) {
                if (!channelGiven) {
                    throw new ConfigurationException(
                            "slack sync \"%s\" invalid: must specify either channel ID or channel name when topic is given"
                                    .formatted(sync.name()));
                }
            } else if (channelGiven) {
                throw new ConfigurationException(
                        "slack sync \"%s\" invalid: must specify template when either channel ID or channel name is given"
                                .formatted(sync.name()));
            }
        }
    }
}
