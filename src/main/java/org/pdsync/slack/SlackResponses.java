package org.pdsync.slack;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Response envelopes of the Slack Web API.
 * Every response carries {@code ok} and, when not ok, an {@code error} code.
 */
public final class SlackResponses {

    private SlackResponses() {
    }

    public interface SlackResponse {
        boolean ok();

        String error();
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResponseMetadata(@JsonProperty("next_cursor") String nextCursor) {
    }

    /**
     * Cursor for the next page, or null when this was the last page.
     */
    static String nextCursor(ResponseMetadata metadata) {
        if (metadata == null || metadata.nextCursor() == null || metadata.nextCursor().isEmpty()) {
            return null;
        }
        return metadata.nextCursor();
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UsersListResponse(
            boolean ok,
            String error,
            List<SlackUser> members,
            @JsonProperty("response_metadata") ResponseMetadata responseMetadata) implements SlackResponse {

        @Override
        public List<SlackUser> members() {
            return members == null ? List.of() : members;
        }
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserGroupsResponse(
            boolean ok,
            String error,
            List<SlackUserGroup> usergroups) implements SlackResponse {

        @Override
        public List<SlackUserGroup> usergroups() {
            return usergroups == null ? List.of() : usergroups;
        }
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserGroupResponse(
            boolean ok,
            String error,
            SlackUserGroup usergroup) implements SlackResponse {
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UserGroupUsersResponse(
            boolean ok,
            String error,
            List<String> users) implements SlackResponse {

        @Override
        public List<String> users() {
            return users == null ? List.of() : users;
        }
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConversationsListResponse(
            boolean ok,
            String error,
            List<SlackChannel> channels,
            @JsonProperty("response_metadata") ResponseMetadata responseMetadata) implements SlackResponse {

        @Override
        public List<SlackChannel> channels() {
            return channels == null ? List.of() : channels;
        }
    }

    /**
     * Response of conversations.info, conversations.join and conversations.setTopic.
     * conversations.join sets {@code warning} to {@code already_in_channel}
     * when the bot already is a member.
     */
    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConversationResponse(
            boolean ok,
            String error,
            String warning,
            SlackChannel channel) implements SlackResponse {
    }
}
