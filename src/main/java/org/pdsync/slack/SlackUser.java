package org.pdsync.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackUser(
        String id,
        String name,
        @JsonProperty("real_name") String realName,
        boolean deleted,
        @JsonProperty("is_bot") boolean bot,
        Profile profile) {

    public String email() {
        return profile == null ? null : profile.email();
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Profile(
            String email,
            @JsonProperty("real_name") String realName,
            @JsonProperty("display_name") String displayName) {
    }

    @Override
    public String toString() {
        return "{ID:%s Name:%s}".formatted(id, name);
    }
}
