package org.pdsync.pagerduty;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.pdsync.pagerduty.PagerDutyResponses.ScheduleListResponse;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleResponse;

import io.quarkus.logging.Log;

/**
 * Implementation of PagerDutyService backed by the PagerDuty REST API.
 * Instantiated by PagerDutyServiceProducer.
 */
class PagerDutyServiceImpl implements PagerDutyService {
    static final String ME = "📟-pagerduty";
    static final int PAGE_SIZE = 100;

    private final PagerDutyClient client;
    private final Clock clock;

    PagerDutyServiceImpl(PagerDutyClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public Optional<PagerDutySchedule> getSchedule(String id, String name) {
        if (id != null && !id.isEmpty()) {
            return getScheduleById(id);
        }
        return getScheduleByName(name);
    }

    Optional<PagerDutySchedule> getScheduleById(String id) {
        try {
            ScheduleResponse response = client.getSchedule(id);
            return Optional.ofNullable(response == null ? null : response.schedule());
        } catch (WebApplicationException e) {
            if (e.getResponse().getStatus() == 404) {
                Log.debugf("[%s] getSchedule: schedule %s not found", ME, id);
                return Optional.empty();
            }
            throw new PagerDutyException("failed to get schedule by ID %s: %s".formatted(id, e.getMessage()), e);
        } catch (ProcessingException e) {
            throw new PagerDutyException("failed to get schedule by ID %s: %s".formatted(id, e.getMessage()), e);
        }
    }

    Optional<PagerDutySchedule> getScheduleByName(String name) {
        int offset = 0;
        do {
            final int pageOffset = offset;
            ScheduleListResponse response = call("list schedules matching \"%s\"".formatted(name),
                    () -> client.listSchedules(name, pageOffset, PAGE_SIZE));

            // query is a substring match; look for the exact name
            for (PagerDutySchedule schedule : response.schedules()) {
                if (name.equals(schedule.name())) {
                    return Optional.of(schedule);
                }
            }

            Log.debugf("[%s] Page at offset %d: %d schedule(s) matching %s, none named exactly",
                    ME, offset, response.schedules().size(), name);

            if (!response.more() || response.schedules().isEmpty()) {
                return Optional.empty();
            }
            offset += response.schedules().size();
        } while (true);
    }

    @Override
    public PagerDutyUser getOnCallUser(PagerDutySchedule schedule) {
        Instant since = clock.instant();
        Instant until = since.plusSeconds(1);

        List<PagerDutyUser> users = call("list on-call users for schedule %s".formatted(schedule),
                () -> client.listOnCallUsers(schedule.id(), since.toString(), until.toString()))
                .users();

        if (users.isEmpty()) {
            throw new PagerDutyException("no on-call user found for schedule %s".formatted(schedule));
        }
        if (users.size() > 1) {
            throw new PagerDutyException("expected exactly one on-call user for schedule %s, found %d: %s"
                    .formatted(schedule, users.size(), users));
        }
        PagerDutyUser user = users.get(0);
        Log.debugf("[%s] on-call user for schedule %s: %s", ME, schedule, user);
        return user;
    }

    private <T> T call(String what, Supplier<T> request) {
        try {
            T result = request.get();
            if (result == null) {
                throw new PagerDutyException("failed to %s: empty response".formatted(what));
            }
            return result;
        } catch (WebApplicationException | ProcessingException e) {
            throw new PagerDutyException("failed to %s: %s".formatted(what, e.getMessage()), e);
        }
    }
}
