package org.pdsync.config;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A Slack channel identified by either ID or name.
 */
@RegisterForReflection
public record ConfigChannel(String id, String name) {

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\"}".formatted(
                id == null ? "" : id,
                name == null ? "" : name);
    }
}
