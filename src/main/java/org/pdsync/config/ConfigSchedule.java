package org.pdsync.config;

import java.util.List;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A PagerDuty schedule identified by either ID or name,
 * and the Slack user groups that should contain its on-call user.
 */
@RegisterForReflection
public record ConfigSchedule(
        String id,
        String name,
        List<ConfigUserGroup> userGroups) {

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    @Override
    public List<ConfigUserGroup> userGroups() {
        return userGroups == null ? List.of() : userGroups;
    }

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\"}".formatted(
                id == null ? "" : id,
                name == null ? "" : name);
    }
}
