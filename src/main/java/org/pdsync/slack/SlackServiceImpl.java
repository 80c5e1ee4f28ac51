package org.pdsync.slack;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.pdsync.slack.SlackResponses.ConversationResponse;
import org.pdsync.slack.SlackResponses.ConversationsListResponse;
import org.pdsync.slack.SlackResponses.SlackResponse;
import org.pdsync.slack.SlackResponses.UsersListResponse;
import org.pdsync.sync.OncallGroups;
import org.pdsync.sync.OncallGroups.OncallGroup;

import io.quarkus.logging.Log;

/**
 * Implementation of SlackService backed by the Slack Web API.
 * Instantiated by SlackServiceProducer.
 */
class SlackServiceImpl implements SlackService {
    static final String ME = "💬-slack";
    static final int PAGE_SIZE = 200;
    static final String CHANNEL_TYPES = "public_channel,private_channel";
    static final String ALREADY_IN_CHANNEL = "already_in_channel";

    private final SlackClient client;

    SlackServiceImpl(SlackClient client) {
        this.client = client;
    }

    @Override
    public List<SlackUser> getUsers() {
        List<SlackUser> users = new ArrayList<>();
        String cursor = null;
        do {
            final String pageCursor = cursor;
            UsersListResponse response = call("users.list", () -> client.listUsers(pageCursor, PAGE_SIZE));
            users.addAll(response.members());
            cursor = SlackResponses.nextCursor(response.responseMetadata());
        } while (cursor != null);

        Log.debugf("[%s] retrieved %d user(s)", ME, users.size());
        return users;
    }

    @Override
    public List<SlackUserGroup> getUserGroups() {
        List<SlackUserGroup> userGroups = call("usergroups.list", () -> client.listUserGroups(true))
                .usergroups();
        Log.debugf("[%s] retrieved %d user group(s)", ME, userGroups.size());
        return userGroups;
    }

    @Override
    public List<SlackChannel> getChannels() {
        List<SlackChannel> channels = new ArrayList<>();
        String cursor = null;
        do {
            final String pageCursor = cursor;
            ConversationsListResponse response = call("conversations.list",
                    () -> client.listConversations(CHANNEL_TYPES, true, pageCursor, PAGE_SIZE));
            channels.addAll(response.channels());
            cursor = SlackResponses.nextCursor(response.responseMetadata());
        } while (cursor != null);

        Log.debugf("[%s] retrieved %d channel(s)", ME, channels.size());
        return channels;
    }

    @Override
    public boolean joinChannel(String channelId) {
        ConversationResponse response = call("conversations.join", () -> client.joinConversation(channelId));
        return !ALREADY_IN_CHANNEL.equals(response.warning());
    }

    @Override
    public void updateOncallGroupMembers(OncallGroups groups, boolean dryRun) {
        for (OncallGroup group : groups) {
            SlackUserGroup userGroup = group.userGroup();
            // Earlier syncs of the same run may have changed the group since it was listed
            List<String> currentMembers = call("usergroups.users.list",
                    () -> client.listUserGroupMembers(userGroup.id())).users();
            MembershipChanges changes = MembershipChanges.compute(userGroup.toString(),
                    currentMembers, group.members());

            if (changes.isEmpty()) {
                Log.infof("[%s] User group %s already has the expected members %s",
                        ME, userGroup, changes.finalMembers());
                continue;
            }

            if (dryRun) {
                Log.infof("[%s] User group %s would change (dry run): add %s; remove %s; final %s",
                        ME, userGroup, changes.addedMembers(), changes.removedMembers(), changes.finalMembers());
                continue;
            }

            Log.infof("[%s] Updating user group %s: add %s; remove %s",
                    ME, userGroup, changes.addedMembers(), changes.removedMembers());
            call("usergroups.users.update", () -> client.updateUserGroupMembers(
                    userGroup.id(), String.join(",", changes.finalMembers())));

            Log.infof("[%s] updateOncallGroupMembers: finished updating %s; %s added; %s removed",
                    ME, userGroup, changes.addedMembers().size(), changes.removedMembers().size());
        }
    }

    @Override
    public void updateTopic(String channelId, String topic, boolean dryRun) {
        ConversationResponse info = call("conversations.info", () -> client.getConversationInfo(channelId));
        String currentTopic = info.channel() == null ? "" : info.channel().topicValue();
        if (topic.equals(currentTopic)) {
            Log.infof("[%s] Topic of channel %s is up to date", ME, channelId);
            return;
        }

        if (dryRun) {
            Log.infof("[%s] Would set topic of channel %s (dry run): %s", ME, channelId, topic);
            return;
        }

        Log.infof("[%s] Setting topic of channel %s: %s", ME, channelId, topic);
        call("conversations.setTopic", () -> client.setTopic(channelId, topic));
    }

    private <T extends SlackResponse> T call(String method, Supplier<T> request) {
        T response;
        try {
            response = request.get();
        } catch (WebApplicationException | ProcessingException e) {
            throw new SlackException("%s failed: %s".formatted(method, e.getMessage()), e);
        }
        if (response == null) {
            throw new SlackException(method, "empty_response");
        }
        if (!response.ok()) {
            throw new SlackException(method, response.error());
        }
        return response;
    }
}
