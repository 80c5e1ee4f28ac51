package org.pdsync.sync;

import java.util.ArrayList;
import java.util.List;

import jakarta.inject.Singleton;

import org.pdsync.ConfigurationException;
import org.pdsync.LookupException;
import org.pdsync.SyncException;
import org.pdsync.slack.SlackChannel;
import org.pdsync.slack.SlackException;
import org.pdsync.slack.SlackService;
import org.pdsync.slack.SlackUser;
import org.pdsync.slack.SlackUserGroup;

import io.quarkus.logging.Log;

/**
 * Resolves configured syncs against the current PagerDuty and Slack data.
 * Any failure here aborts the run before a sync is executed.
 */
@Singleton
public class SlackSyncFactory {
    static final String ME = "🏗️-prepare";

    final SlackService slack;
    final ScheduleAggregator aggregator;

    public SlackSyncFactory(SlackService slack, ScheduleAggregator aggregator) {
        this.slack = slack;
        this.aggregator = aggregator;
    }

    /**
     * @throws ConfigurationException if a sync references something that can not be resolved
     * @throws LookupException if Slack data can not be fetched
     */
    public SyncPlan createSlackSyncs(List<SyncJob> jobs) {
        IdentityResolver resolver = createResolver(jobs);

        List<RunSlackSync> syncs = new ArrayList<>();
        for (SyncJob job : jobs) {
            try {
                syncs.add(createSlackSync(job, resolver));
            } catch (SyncException e) {
                throw new ConfigurationException("failed to create slack sync \"%s\": %s"
                        .formatted(job.name(), e.getMessage()), e);
            }
        }
        return new SyncPlan(resolver, syncs);
    }

    RunSlackSync createSlackSync(SyncJob job, IdentityResolver resolver) {
        String channelId = null;
        if (job.hasChannel()) {
            SlackChannel channel = resolver.resolveChannel(job.channel());
            channelId = channel.id();
            Log.infof("[%s] Slack sync %s: found Slack channel \"%s\" (ID %s)",
                    ME, job.name(), channel.name(), channel.id());
        }

        SyncSchedules schedules = aggregator.aggregate(job, resolver);

        return new RunSlackSync(job.name(), schedules, channelId,
                job.topicTemplate(), job.dryRun(), job.pretendUsers());
    }

    IdentityResolver createResolver(List<SyncJob> jobs) {
        try {
            List<SlackUser> users = slack.getUsers();
            List<SlackUserGroup> userGroups = slack.getUserGroups();
            // Listing channels needs extra scopes; only do it when needed
            List<SlackChannel> channels = jobs.stream().anyMatch(SyncJob::hasChannel)
                    ? slack.getChannels()
                    : List.of();
            Log.debugf("[%s] %d user(s), %d user group(s), %d channel(s)",
                    ME, users.size(), userGroups.size(), channels.size());
            return new IdentityResolver(users, userGroups, channels);
        } catch (SlackException e) {
            throw new LookupException("failed to get Slack data: %s".formatted(e.getMessage()), e);
        }
    }
}
