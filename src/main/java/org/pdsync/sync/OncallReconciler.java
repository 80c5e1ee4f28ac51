package org.pdsync.sync;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Singleton;

import org.pdsync.LookupException;
import org.pdsync.MutationException;
import org.pdsync.TopicTemplateException;
import org.pdsync.pagerduty.PagerDutyException;
import org.pdsync.pagerduty.PagerDutyService;
import org.pdsync.pagerduty.PagerDutyUser;
import org.pdsync.slack.SlackException;
import org.pdsync.slack.SlackService;
import org.pdsync.slack.SlackUser;
import org.pdsync.slack.SlackUserGroup;

import io.quarkus.logging.Log;

/**
 * Computes the expected members of each user group from the current
 * on-call users, and applies them (and the channel topic) to Slack.
 */
@Singleton
public class OncallReconciler {
    static final String ME = "🔁-reconcile";

    final PagerDutyService pagerDuty;
    final SlackService slack;

    public OncallReconciler(PagerDutyService pagerDuty, SlackService slack) {
        this.pagerDuty = pagerDuty;
        this.slack = slack;
    }

    /**
     * @param groups expected members per user group
     * @param userIdByScheduleName topic template key to (possibly escaped) Slack user id
     * @param keyCollision description of the first template key shared by two schedules, or null
     */
    public record Reconciliation(OncallGroups groups, Map<String, String> userIdByScheduleName, String keyCollision) {

        public boolean hasKeyCollision() {
            return keyCollision != null;
        }
    }

    /**
     * Resolve the on-call user of every schedule (in order) and collect
     * user group members and topic values.
     *
     * Two schedules mapping to the same template key do not fail here:
     * the first one keeps the key and the collision is reported by
     * {@link #updateTopic(RunSlackSync, Reconciliation)}, after membership was applied.
     *
     * @throws LookupException if an on-call user can not be determined or mapped to Slack
     */
    public Reconciliation computeOncallGroups(RunSlackSync sync, IdentityResolver resolver) {
        OncallGroups ocgs = new OncallGroups();
        Map<String, String> userIdByScheduleName = new LinkedHashMap<>();
        Map<String, SyncSchedule> scheduleByKey = new HashMap<>();
        String keyCollision = null;

        for (SyncSchedule schedule : sync.schedules()) {
            Log.infof("[%s] Processing schedule %s", ME, schedule);
            PagerDutyUser onCallUser;
            try {
                onCallUser = pagerDuty.getOnCallUser(schedule.schedule());
            } catch (PagerDutyException e) {
                throw new LookupException("failed to get on call user for schedule \"%s\": %s"
                        .formatted(schedule.name(), e.getMessage()), e);
            }

            SlackUser slUser = resolver.resolveUser(onCallUser);

            for (SlackUserGroup userGroup : schedule.userGroups()) {
                Log.infof("[%s] Ensuring member %s for user group %s", ME, slUser.id(), userGroup);
                ocgs.getOrCreate(userGroup).ensureMember(slUser.id());
            }

            // The backslash keeps Slack from turning the id into a mention
            String slUserId = sync.pretendUsers() ? "\\" + slUser.id() : slUser.id();

            String key = TopicTemplate.toKey(schedule.name());
            SyncSchedule previous = scheduleByKey.putIfAbsent(key, schedule);
            if (previous != null) {
                String msg = "schedules %s and %s both map to template key \"%s\"".formatted(previous, schedule, key);
                Log.warnf("[%s] Slack sync %s: %s", ME, sync.name(), msg);
                if (keyCollision == null) {
                    keyCollision = msg;
                }
                continue;
            }
            userIdByScheduleName.put(key, slUserId);
        }
        return new Reconciliation(ocgs, userIdByScheduleName, keyCollision);
    }

    /**
     * Apply the expected members of all user groups in one call.
     *
     * @throws MutationException if Slack rejects the update
     */
    public void updateMembers(RunSlackSync sync, OncallGroups groups) {
        try {
            slack.updateOncallGroupMembers(groups, sync.dryRun());
        } catch (SlackException e) {
            throw new MutationException("failed to update on-call user group members: %s"
                    .formatted(e.getMessage()), e);
        }
    }

    /**
     * Render the topic template and set the channel topic.
     *
     * @return the rendered topic, or null if the sync has no template
     * @throws TopicTemplateException if two schedules share a template key,
     *         or the template can not be rendered
     * @throws MutationException if Slack rejects the update
     */
    public String updateTopic(RunSlackSync sync, Reconciliation reconciliation) {
        if (sync.topicTemplate() == null) {
            Log.debugf("[%s] Slack sync %s: skipping topic update", ME, sync.name());
            return null;
        }
        if (reconciliation.hasKeyCollision()) {
            throw new TopicTemplateException(reconciliation.keyCollision());
        }

        Map<String, String> userIdByScheduleName = reconciliation.userIdByScheduleName();

        Log.infof("[%s] Executing template with Slack user IDs by schedule name: %s", ME, userIdByScheduleName);
        String topic = sync.topicTemplate().render(userIdByScheduleName);

        try {
            slack.updateTopic(sync.channelId(), topic, sync.dryRun());
        } catch (SlackException e) {
            throw new MutationException("failed to update topic: %s".formatted(e.getMessage()), e);
        }
        return topic;
    }
}
