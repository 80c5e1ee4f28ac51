package org.pdsync.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.inject.Singleton;

import org.pdsync.LookupException;
import org.pdsync.config.ConfigSchedule;
import org.pdsync.config.ConfigUserGroup;
import org.pdsync.pagerduty.PagerDutyException;
import org.pdsync.pagerduty.PagerDutySchedule;
import org.pdsync.pagerduty.PagerDutyService;
import org.pdsync.slack.SlackUserGroup;

import io.quarkus.logging.Log;

/**
 * Resolves the configured schedules of a sync into a deduplicated,
 * ordered set of PagerDuty schedules annotated with their user groups.
 */
@Singleton
public class ScheduleAggregator {
    static final String ME = "📅-schedules";

    final PagerDutyService pagerDuty;

    public ScheduleAggregator(PagerDutyService pagerDuty) {
        this.pagerDuty = pagerDuty;
    }

    /**
     * A schedule referenced more than once (by ID or by name) appears once,
     * with the union of all referenced user groups.
     *
     * @throws LookupException if a schedule or user group can not be found
     */
    public SyncSchedules aggregate(SyncJob job, IdentityResolver resolver) {
        SyncSchedules schedules = new SyncSchedules();

        Log.infof("[%s] Slack sync %s: Getting PagerDuty schedules", ME, job.name());
        for (ConfigSchedule cfgSchedule : job.schedules()) {
            PagerDutySchedule pdSchedule = getSchedule(cfgSchedule);

            List<SlackUserGroup> userGroups = new ArrayList<>();
            for (ConfigUserGroup cfgUserGroup : cfgSchedule.userGroups()) {
                SlackUserGroup userGroup = resolver.resolveGroup(cfgUserGroup);
                Log.infof("[%s] Slack sync %s: assigning user group %s to schedule %s",
                        ME, job.name(), userGroup, pdSchedule);
                userGroups.add(userGroup);
            }

            schedules.ensureSchedule(pdSchedule, userGroups);
        }

        Log.infof("[%s] Slack sync %s: found %d PagerDuty schedule(s)", ME, job.name(), schedules.size());
        return schedules;
    }

    PagerDutySchedule getSchedule(ConfigSchedule cfgSchedule) {
        Optional<PagerDutySchedule> pdSchedule;
        try {
            pdSchedule = pagerDuty.getSchedule(cfgSchedule.id(), cfgSchedule.name());
        } catch (PagerDutyException e) {
            throw new LookupException("failed to get schedule %s: %s".formatted(cfgSchedule, e.getMessage()), e);
        }
        return pdSchedule.orElseThrow(
                () -> new LookupException("schedule %s not found".formatted(cfgSchedule)));
    }
}
