package org.pdsync.config;

import java.util.List;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A synchronization between a set of PagerDuty schedules and Slack
 * user groups, optionally maintaining the topic of a Slack channel.
 *
 * @param name Unique name of the sync
 * @param schedules Schedules and the user groups they feed
 * @param channel Channel whose topic is maintained (requires template)
 * @param template Topic template (requires channel)
 * @param pretendUsers If true, user ids in the topic do not mention users
 * @param dryRun If true, compute and log changes without applying them
 */
@RegisterForReflection
public record ConfigSlackSync(
        String name,
        List<ConfigSchedule> schedules,
        ConfigChannel channel,
        String template,
        Boolean pretendUsers,
        Boolean dryRun) {

    @Override
    public List<ConfigSchedule> schedules() {
        return schedules == null ? List.of() : schedules;
    }

    public boolean hasTemplate() {
        return template != null && !template.isEmpty();
    }

    public boolean pretendUsersEnabled() {
        return pretendUsers != null && pretendUsers;
    }

    public boolean dryRunEnabled() {
        return dryRun != null && dryRun;
    }

    /**
     * Globally defined parameters override per-sync ones.
     *
     * @param dryRunOverride dry run value to force, or null
     * @param pretendUsersOverride pretend users value to force, or null
     * @return this sync, or a copy with the overrides applied
     */
    public ConfigSlackSync withOverrides(Boolean dryRunOverride, Boolean pretendUsersOverride) {
        if (dryRunOverride == null && pretendUsersOverride == null) {
            return this;
        }
        return new ConfigSlackSync(name, schedules, channel, template,
                pretendUsersOverride == null ? pretendUsers : pretendUsersOverride,
                dryRunOverride == null ? dryRun : dryRunOverride);
    }

    @Override
    public String toString() {
        return "ConfigSlackSync{name='%s', schedules=%s, channel=%s, template=%s, pretendUsers=%s, dryRun=%s}"
                .formatted(name, schedules(), channel, hasTemplate(), pretendUsersEnabled(), dryRunEnabled());
    }
}
