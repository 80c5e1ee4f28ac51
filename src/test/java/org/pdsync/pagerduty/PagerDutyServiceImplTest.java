package org.pdsync.pagerduty;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleListResponse;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleResponse;
import org.pdsync.pagerduty.PagerDutyResponses.ScheduleUsersResponse;

class PagerDutyServiceImplTest {

    static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    static final PagerDutySchedule PRIMARY = new PagerDutySchedule("P1", "Primary");

    PagerDutyClient client;
    PagerDutyServiceImpl service;

    @BeforeEach
    void setup() {
        client = mock(PagerDutyClient.class);
        service = new PagerDutyServiceImpl(client, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testGetScheduleById() {
        when(client.getSchedule("P1")).thenReturn(new ScheduleResponse(PRIMARY));

        assertThat(service.getSchedule("P1", null)).contains(PRIMARY);
        verify(client, never()).listSchedules(anyString(), anyInt(), anyInt());
    }

    @Test
    void testGetScheduleByIdNotFound() {
        when(client.getSchedule("P404")).thenThrow(new WebApplicationException(404));

        assertThat(service.getSchedule("P404", null)).isEmpty();
    }

    @Test
    void testGetScheduleByIdServerError() {
        when(client.getSchedule("P1")).thenThrow(new WebApplicationException(500));

        assertThatThrownBy(() -> service.getSchedule("P1", null))
                .isInstanceOf(PagerDutyException.class)
                .hasMessageStartingWith("failed to get schedule by ID P1");
    }

    @Test
    void testGetScheduleByNameIsExactAcrossPages() {
        when(client.listSchedules("Primary", 0, PagerDutyServiceImpl.PAGE_SIZE)).thenReturn(
                new ScheduleListResponse(List.of(new PagerDutySchedule("P7", "Primary (old)")), 0, 100, true));
        when(client.listSchedules("Primary", 1, PagerDutyServiceImpl.PAGE_SIZE)).thenReturn(
                new ScheduleListResponse(List.of(new PagerDutySchedule("P8", "primary"), PRIMARY), 1, 100, false));

        assertThat(service.getSchedule("", "Primary")).contains(PRIMARY);
    }

    @Test
    void testGetScheduleByNameNotFound() {
        when(client.listSchedules("Primary", 0, PagerDutyServiceImpl.PAGE_SIZE)).thenReturn(
                new ScheduleListResponse(List.of(new PagerDutySchedule("P7", "Primary (old)")), 0, 100, false));

        assertThat(service.getSchedule(null, "Primary")).isEmpty();
    }

    @Test
    void testGetOnCallUser() {
        PagerDutyUser alice = new PagerDutyUser("PU1", "Alice", "alice@example.com");
        when(client.listOnCallUsers("P1", "2024-05-01T10:00:00Z", "2024-05-01T10:00:01Z"))
                .thenReturn(new ScheduleUsersResponse(List.of(alice)));

        assertThat(service.getOnCallUser(PRIMARY)).isEqualTo(alice);
    }

    @Test
    void testGetOnCallUserRequiresExactlyOne() {
        when(client.listOnCallUsers(anyString(), anyString(), anyString()))
                .thenReturn(new ScheduleUsersResponse(List.of()));

        assertThatThrownBy(() -> service.getOnCallUser(PRIMARY))
                .isInstanceOf(PagerDutyException.class)
                .hasMessage("no on-call user found for schedule {ID:P1 Name:\"Primary\"}");

        when(client.listOnCallUsers(anyString(), anyString(), anyString()))
                .thenReturn(new ScheduleUsersResponse(List.of(
                        new PagerDutyUser("PU1", "Alice", "alice@example.com"),
                        new PagerDutyUser("PU2", "Bob", "bob@example.com"))));

        assertThatThrownBy(() -> service.getOnCallUser(PRIMARY))
                .isInstanceOf(PagerDutyException.class)
                .hasMessageStartingWith("expected exactly one on-call user for schedule {ID:P1 Name:\"Primary\"}, found 2");
    }

    @Test
    void testConnectionFailure() {
        when(client.listOnCallUsers(anyString(), anyString(), anyString()))
                .thenThrow(new ProcessingException("Connection refused"));

        assertThatThrownBy(() -> service.getOnCallUser(PRIMARY))
                .isInstanceOf(PagerDutyException.class)
                .hasMessageContaining("Connection refused");
    }
}
