package org.pdsync.pagerduty;

import java.util.Optional;

/**
 * Schedule and on-call lookups against PagerDuty.
 */
public interface PagerDutyService {

    /**
     * Find a schedule by ID, or (when no ID is given) by exact name.
     *
     * @param id schedule ID, may be null or empty
     * @param name schedule name, used when id is null or empty
     * @return the schedule, or empty if it does not exist
     * @throws PagerDutyException if the lookup fails
     */
    Optional<PagerDutySchedule> getSchedule(String id, String name);

    /**
     * Get the user currently on call for a schedule.
     *
     * @param schedule schedule to query
     * @return the on-call user
     * @throws PagerDutyException if the lookup fails or does not yield exactly one user
     */
    PagerDutyUser getOnCallUser(PagerDutySchedule schedule);
}
