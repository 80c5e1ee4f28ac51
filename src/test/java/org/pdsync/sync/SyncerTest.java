package org.pdsync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.pdsync.sync.SyncFixtures.ALICE_PD;
import static org.pdsync.sync.SyncFixtures.ONCALL;
import static org.pdsync.sync.SyncFixtures.PRIMARY;
import static org.pdsync.sync.SyncFixtures.SECONDARY;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.pdsync.SyncException;
import org.pdsync.pagerduty.PagerDutyException;
import org.pdsync.pagerduty.PagerDutySchedule;
import org.pdsync.pagerduty.PagerDutyService;
import org.pdsync.slack.SlackException;
import org.pdsync.slack.SlackService;

class SyncerTest {

    static final BooleanSupplier NOT_CANCELLED = () -> false;

    PagerDutyService pagerDuty;
    SlackService slack;
    Syncer syncer;

    @BeforeEach
    void setup() {
        pagerDuty = mock(PagerDutyService.class);
        slack = mock(SlackService.class);
        syncer = new Syncer(new OncallReconciler(pagerDuty, slack), slack);

        when(pagerDuty.getOnCallUser(PRIMARY)).thenReturn(ALICE_PD);
        when(pagerDuty.getOnCallUser(SECONDARY)).thenThrow(new PagerDutyException("HTTP 503"));
        when(slack.joinChannel(anyString())).thenReturn(true);
    }

    static RunSlackSync sync(String name, SyncSchedules schedules, boolean withTopic, boolean dryRun) {
        return new RunSlackSync(name, schedules,
                withTopic ? "C1" : null,
                withTopic ? TopicTemplate.parse(name, "{PrimaryRotation}") : null,
                dryRun, false);
    }

    SyncPlan threeSyncs() {
        return new SyncPlan(SyncFixtures.resolver(), List.of(
                sync("one", SyncFixtures.schedules(PRIMARY, ONCALL), false, false),
                sync("two", SyncFixtures.schedules(SECONDARY, ONCALL), false, false),
                sync("three", SyncFixtures.schedules(PRIMARY, ONCALL), true, false)));
    }

    @Test
    void testFailingSyncDoesNotStopOthers() {
        Map<String, SyncState> states = syncer.run(threeSyncs(), false, NOT_CANCELLED);

        assertThat(states).containsExactly(
                Map.entry("one", SyncState.DONE),
                Map.entry("two", SyncState.FAILED),
                Map.entry("three", SyncState.DONE));
        verify(slack, times(2)).updateOncallGroupMembers(any(), anyBoolean());
        verify(slack).joinChannel("C1");
        verify(slack).updateTopic("C1", "U1", false);
    }

    @Test
    void testFailFast() {
        assertThatThrownBy(() -> syncer.run(threeSyncs(), true, NOT_CANCELLED))
                .isInstanceOf(SyncException.class)
                .hasMessage("failed to run Slack sync two: failed to get on call user for schedule \"Secondary-Rotation\": HTTP 503");

        verify(pagerDuty, times(1)).getOnCallUser(PRIMARY);
        verify(slack, never()).updateTopic(anyString(), anyString(), anyBoolean());
    }

    @Test
    void testCancelledBeforeStart() {
        assertThatThrownBy(() -> syncer.run(threeSyncs(), false, () -> true))
                .isInstanceOf(SyncException.class)
                .hasMessage("sync run cancelled before Slack sync one");

        verifyNoInteractions(pagerDuty, slack);
    }

    @Test
    void testCancelledDuringFailingSync() {
        AtomicInteger checks = new AtomicInteger();
        // cancelled after the second sync started
        BooleanSupplier cancelled = () -> checks.incrementAndGet() > 2;

        assertThatThrownBy(() -> syncer.run(threeSyncs(), false, cancelled))
                .isInstanceOf(SyncException.class)
                .hasMessageStartingWith("failed to run Slack sync two: ");

        verify(pagerDuty, times(1)).getOnCallUser(PRIMARY);
    }

    @Test
    void testMissingScopeOnJoinIsNotFatal() {
        when(slack.joinChannel("C1")).thenThrow(new SlackException("conversations.join", "missing_scope"));
        SyncPlan plan = new SyncPlan(SyncFixtures.resolver(), List.of(
                sync("one", SyncFixtures.schedules(PRIMARY, ONCALL), true, false)));

        Map<String, SyncState> states = syncer.run(plan, true, NOT_CANCELLED);

        assertThat(states).containsEntry("one", SyncState.DONE);
        verify(slack).updateTopic("C1", "U1", false);
    }

    @Test
    void testJoinFailure() {
        when(slack.joinChannel("C1")).thenThrow(new SlackException("conversations.join", "channel_not_found"));
        SyncPlan plan = new SyncPlan(SyncFixtures.resolver(), List.of(
                sync("one", SyncFixtures.schedules(PRIMARY, ONCALL), true, false)));

        assertThatThrownBy(() -> syncer.run(plan, true, NOT_CANCELLED))
                .isInstanceOf(SyncException.class)
                .hasMessage("failed to run Slack sync one: failed to join channel with ID C1: conversations.join failed: channel_not_found");
        verify(slack, never()).updateOncallGroupMembers(any(), anyBoolean());
    }

    @Test
    void testDryRunDoesNotJoin() {
        SyncPlan plan = new SyncPlan(SyncFixtures.resolver(), List.of(
                sync("one", SyncFixtures.schedules(PRIMARY, ONCALL), true, true)));

        Map<String, SyncState> states = syncer.run(plan, false, NOT_CANCELLED);

        assertThat(states).containsEntry("one", SyncState.DONE);
        verify(slack, never()).joinChannel(anyString());
        verify(slack).updateOncallGroupMembers(any(), eq(true));
        verify(slack).updateTopic("C1", "U1", true);
    }

    @Test
    void testTemplateKeyCollisionStillUpdatesMembers() {
        PagerDutySchedule primaryDash = new PagerDutySchedule("P3", "Primary-Rotation");
        when(pagerDuty.getOnCallUser(primaryDash)).thenReturn(ALICE_PD);
        SyncSchedules schedules = SyncFixtures.schedules(PRIMARY, ONCALL);
        schedules.ensureSchedule(primaryDash, List.of(ONCALL));
        SyncPlan plan = new SyncPlan(SyncFixtures.resolver(), List.of(sync("one", schedules, true, false)));

        Map<String, SyncState> states = syncer.run(plan, false, NOT_CANCELLED);

        assertThat(states).containsEntry("one", SyncState.FAILED);
        ArgumentCaptor<OncallGroups> groups = ArgumentCaptor.forClass(OncallGroups.class);
        verify(slack).updateOncallGroupMembers(groups.capture(), eq(false));
        assertThat(groups.getValue().members("S1")).containsExactly("U1");
        verify(slack, never()).updateTopic(anyString(), anyString(), anyBoolean());
    }

    @Test
    void testCapitalize() {
        assertThat(Syncer.capitalize("failed to run")).isEqualTo("Failed to run");
        assertThat(Syncer.capitalize("")).isEmpty();
    }
}
