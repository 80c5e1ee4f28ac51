package org.pdsync.pagerduty;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Response envelopes of the PagerDuty REST API (v2).
 */
public final class PagerDutyResponses {

    private PagerDutyResponses() {
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleResponse(PagerDutySchedule schedule) {
    }

    /**
     * Classic pagination: the next page starts at {@code offset + limit}
     * while {@code more} is true.
     */
    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleListResponse(
            List<PagerDutySchedule> schedules,
            int offset,
            int limit,
            boolean more) {

        @Override
        public List<PagerDutySchedule> schedules() {
            return schedules == null ? List.of() : schedules;
        }
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScheduleUsersResponse(List<PagerDutyUser> users) {

        @Override
        public List<PagerDutyUser> users() {
            return users == null ? List.of() : users;
        }
    }
}
