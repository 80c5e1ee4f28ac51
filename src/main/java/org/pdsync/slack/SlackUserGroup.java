package org.pdsync.slack;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A Slack user group, with its members when listed with {@code include_users}.
 */
@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackUserGroup(
        String id,
        String name,
        String handle,
        List<String> users) {

    @Override
    public List<String> users() {
        return users == null ? List.of() : users;
    }

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\" Handle:%s}".formatted(id, name, handle);
    }
}
