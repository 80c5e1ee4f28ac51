package org.pdsync.sync;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.pdsync.pagerduty.PagerDutySchedule;
import org.pdsync.slack.SlackUserGroup;

/**
 * Ordered set of schedules, deduplicated by PagerDuty schedule ID.
 */
public class SyncSchedules implements Iterable<SyncSchedule> {
    private final Map<String, SyncSchedule> schedules = new LinkedHashMap<>();

    /**
     * Add a schedule, or merge the user groups into the existing entry
     * for the same schedule.
     *
     * @return the (possibly pre-existing) entry for the schedule
     */
    public SyncSchedule ensureSchedule(PagerDutySchedule schedule, Collection<SlackUserGroup> userGroups) {
        SyncSchedule entry = schedules.computeIfAbsent(schedule.id(), k -> new SyncSchedule(schedule));
        entry.addUserGroups(userGroups);
        return entry;
    }

    public SyncSchedule get(String scheduleId) {
        return schedules.get(scheduleId);
    }

    public int size() {
        return schedules.size();
    }

    public boolean isEmpty() {
        return schedules.isEmpty();
    }

    @Override
    public Iterator<SyncSchedule> iterator() {
        return schedules.values().iterator();
    }

    @Override
    public String toString() {
        return schedules.values().toString();
    }
}
