package org.pdsync.pagerduty;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;

import org.pdsync.pagerduty.PagerDutyResponses.ScheduleListResponse;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleResponse;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleUsersResponse;

/**
 * PagerDuty REST API client.
 * Authentication and API version headers are added by {@link PagerDutyClientFilter}.
 */
public interface PagerDutyClient {

    /**
     * @throws jakarta.ws.rs.WebApplicationException with status 404 if the schedule does not exist
     */
    @GET
    @Path("/schedules/{id}")
    ScheduleResponse getSchedule(@PathParam("id") String id);

    /**
     * Schedules whose name contains the query string
     */
    @GET
    @Path("/schedules")
    ScheduleListResponse listSchedules(
            @QueryParam("query") String query,
            @QueryParam("offset") int offset,
            @QueryParam("limit") int limit);

    /**
     * Users on call for the schedule in the given (ISO-8601) time range
     */
    @GET
    @Path("/schedules/{id}/users")
    ScheduleUsersResponse listOnCallUsers(
            @PathParam("id") String id,
            @QueryParam("since") String since,
            @QueryParam("until") String until);
}
