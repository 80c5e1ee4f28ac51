package org.pdsync.slack;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import org.pdsync.slack.SlackResponses.ConversationResponse;
import org.pdsync.slack.SlackResponses.ConversationsListResponse;
import org.pdsync.slack.SlackResponses.UserGroupResponse;
import org.pdsync.slack.SlackResponses.UserGroupUsersResponse;
import org.pdsync.slack.SlackResponses.UserGroupsResponse;
import org.pdsync.slack.SlackResponses.UsersListResponse;

/**
 * Slack Web API REST client.
 * The bot token is added by {@link SlackClientFilter}.
 * <p>
 * Note: Slack reports most errors with HTTP 200 and {@code "ok": false}.
 */
public interface SlackClient {

    @GET
    @Path("/users.list")
    UsersListResponse listUsers(
            @QueryParam("cursor") String cursor,
            @QueryParam("limit") int limit);

    @GET
    @Path("/usergroups.list")
    UserGroupsResponse listUserGroups(@QueryParam("include_users") boolean includeUsers);

    /**
     * Current members of a single user group
     */
    @GET
    @Path("/usergroups.users.list")
    UserGroupUsersResponse listUserGroupMembers(@QueryParam("usergroup") String usergroup);

    @GET
    @Path("/conversations.list")
    ConversationsListResponse listConversations(
            @QueryParam("types") String types,
            @QueryParam("exclude_archived") boolean excludeArchived,
            @QueryParam("cursor") String cursor,
            @QueryParam("limit") int limit);

    @GET
    @Path("/conversations.info")
    ConversationResponse getConversationInfo(@QueryParam("channel") String channel);

    @POST
    @Path("/conversations.join")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    ConversationResponse joinConversation(@FormParam("channel") String channel);

    @POST
    @Path("/conversations.setTopic")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    ConversationResponse setTopic(
            @FormParam("channel") String channel,
            @FormParam("topic") String topic);

    /**
     * Replace the members of a user group.
     *
     * @param usergroup user group ID
     * @param users comma-separated user IDs
     */
    @POST
    @Path("/usergroups.users.update")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    UserGroupResponse updateUserGroupMembers(
            @FormParam("usergroup") String usergroup,
            @FormParam("users") String users);
}
