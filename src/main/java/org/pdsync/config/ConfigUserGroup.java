package org.pdsync.config;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Reference to a Slack user group.
 * Exactly one of id, name or handle should be set.
 *
 * @param id Slack user group ID
 * @param name Slack user group display name
 * @param handle Slack user group handle (without the leading @)
 */
@RegisterForReflection
public record ConfigUserGroup(String id, String name, String handle) {

    public static ConfigUserGroup ofId(String id) {
        return new ConfigUserGroup(id, null, null);
    }

    public static ConfigUserGroup ofName(String name) {
        return new ConfigUserGroup(null, name, null);
    }

    public static ConfigUserGroup ofHandle(String handle) {
        return new ConfigUserGroup(null, null, handle);
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public boolean hasHandle() {
        return handle != null && !handle.isEmpty();
    }

    /**
     * @return the number of non-empty discriminants
     */
    public int discriminants() {
        return (hasId() ? 1 : 0) + (hasName() ? 1 : 0) + (hasHandle() ? 1 : 0);
    }

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\" Handle:%s}".formatted(
                id == null ? "" : id,
                name == null ? "" : name,
                handle == null ? "" : handle);
    }
}
