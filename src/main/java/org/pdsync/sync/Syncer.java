package org.pdsync.sync;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

import jakarta.inject.Singleton;

import org.pdsync.MutationException;
import org.pdsync.SyncException;
import org.pdsync.slack.SlackException;
import org.pdsync.slack.SlackService;
import org.pdsync.sync.OncallReconciler.Reconciliation;

import io.quarkus.logging.Log;

/**
 * Runs resolved syncs one after another, in configuration order.
 * <p>
 * A failing sync aborts the run when fail-fast is enabled or the run
 * was cancelled; otherwise the failure is logged and the next sync runs.
 */
@Singleton
public class Syncer {
    static final String ME = "🔄-syncer";

    final OncallReconciler reconciler;
    final SlackService slack;

    public Syncer(OncallReconciler reconciler, SlackService slack) {
        this.reconciler = reconciler;
        this.slack = slack;
    }

    /**
     * Run all syncs in order.
     * <p>
     * Cancellation is checked before each sync and after a sync fails.
     * If a sync fails and the run is cancelled at that point, the run is
     * aborted with that sync's error. If the run is cancelled while no sync
     * is failing, the run is aborted with a cancellation error naming the
     * first sync that was not started, so the caller can tell that syncs were
     * skipped.
     *
     * @param plan syncs to run
     * @param failFast abort on the first failing sync
     * @param cancelled checked before each sync; no sync starts once it returns true
     * @return final state of every sync, in run order
     * @throws SyncException if the run was aborted
     */
    public Map<String, SyncState> run(SyncPlan plan, boolean failFast, BooleanSupplier cancelled) {
        Map<String, SyncState> states = new LinkedHashMap<>();
        plan.syncs().forEach(s -> states.put(s.name(), SyncState.PENDING));

        for (RunSlackSync sync : plan.syncs()) {
            if (cancelled.getAsBoolean()) {
                throw new SyncException("sync run cancelled before Slack sync %s".formatted(sync.name()));
            }
            try {
                runSlackSync(sync, plan.resolver(), states);
            } catch (RuntimeException e) {
                states.put(sync.name(), SyncState.FAILED);
                String msg = "failed to run Slack sync %s: %s".formatted(sync.name(),
                        e.getMessage() == null ? e.toString() : e.getMessage());
                if (failFast || cancelled.getAsBoolean()) {
                    throw new SyncException(msg, e);
                }
                Log.error(capitalize(msg));
                Log.debugf(e, "[%s] Slack sync %s failed", ME, sync.name());
            }
        }
        return states;
    }

    void runSlackSync(RunSlackSync sync, IdentityResolver resolver, Map<String, SyncState> states) {
        transition(states, sync, SyncState.JOINING_CHANNEL);
        joinChannel(sync);

        transition(states, sync, SyncState.UPDATING_MEMBERSHIP);
        Reconciliation reconciliation = reconciler.computeOncallGroups(sync, resolver);
        reconciler.updateMembers(sync, reconciliation.groups());

        transition(states, sync, SyncState.UPDATING_TOPIC);
        reconciler.updateTopic(sync, reconciliation);

        transition(states, sync, SyncState.DONE);
    }

    /**
     * A missing scope is reported but does not fail the sync:
     * the bot can be added to the channel manually.
     */
    void joinChannel(RunSlackSync sync) {
        if (sync.dryRun()) {
            return;
        }
        if (!sync.hasChannel()) {
            Log.debugf("[%s] no channel for %s slack sync, so skip joining", ME, sync.name());
            return;
        }

        try {
            if (slack.joinChannel(sync.channelId())) {
                Log.infof("[%s] joined channel with ID %s", ME, sync.channelId());
            }
        } catch (SlackException e) {
            if (!e.isMissingScope()) {
                throw new MutationException("failed to join channel with ID %s: %s"
                        .formatted(sync.channelId(), e.getMessage()), e);
            }
            Log.warnf("[%s] cannot automatically join channel with ID %s because of missing scope \"channels:join\""
                    + " -- please add the scope or join pdsync manually", ME, sync.channelId());
        }
    }

    private void transition(Map<String, SyncState> states, RunSlackSync sync, SyncState state) {
        Log.debugf("[%s] Slack sync %s: %s -> %s", ME, sync.name(), states.get(sync.name()), state);
        states.put(sync.name(), state);
    }

    static String capitalize(String msg) {
        if (msg == null || msg.isEmpty()) {
            return msg;
        }
        return Character.toUpperCase(msg.charAt(0)) + msg.substring(1);
    }
}
