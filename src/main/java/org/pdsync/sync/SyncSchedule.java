package org.pdsync.sync;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.pdsync.pagerduty.PagerDutySchedule;
import org.pdsync.slack.SlackUserGroup;

/**
 * A PagerDuty schedule and the Slack user groups that track its on-call user.
 * User groups are kept in order of first reference, without duplicates.
 */
public class SyncSchedule {
    final PagerDutySchedule schedule;
    final Map<String, SlackUserGroup> userGroups = new LinkedHashMap<>();

    SyncSchedule(PagerDutySchedule schedule) {
        this.schedule = schedule;
    }

    public PagerDutySchedule schedule() {
        return schedule;
    }

    public String id() {
        return schedule.id();
    }

    public String name() {
        return schedule.name();
    }

    public Collection<SlackUserGroup> userGroups() {
        return Collections.unmodifiableCollection(userGroups.values());
    }

    void addUserGroups(Collection<SlackUserGroup> groups) {
        for (SlackUserGroup group : groups) {
            userGroups.putIfAbsent(group.id(), group);
        }
    }

    @Override
    public String toString() {
        return schedule.toString();
    }
}
