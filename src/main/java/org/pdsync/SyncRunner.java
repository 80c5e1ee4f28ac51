package org.pdsync;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import org.pdsync.config.SyncBotConfig;
import org.pdsync.sync.SlackSyncFactory;
import org.pdsync.sync.SyncJob;
import org.pdsync.sync.SyncPlan;
import org.pdsync.sync.SyncState;
import org.pdsync.sync.Syncer;

import io.quarkus.logging.Log;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;

/**
 * Runs the configured syncs, either once or periodically (daemon mode).
 * <p>
 * Each run resolves all syncs against freshly fetched Slack data before
 * any sync is executed. Runs never overlap.
 */
@ApplicationScoped
public class SyncRunner {
    static final String ME = "⏰-runner";

    final SyncBotConfig botConfig;
    final SlackSyncFactory syncFactory;
    final Syncer syncer;

    final AtomicBoolean cancelled = new AtomicBoolean(false);
    final ReentrantLock runLock = new ReentrantLock();

    volatile List<SyncJob> daemonJobs;
    volatile String lastRun = "never";

    public SyncRunner(SyncBotConfig botConfig, SlackSyncFactory syncFactory, Syncer syncer) {
        this.botConfig = botConfig;
        this.syncFactory = syncFactory;
        this.syncer = syncer;
    }

    void onStop(@Observes ShutdownEvent ev) {
        Log.infof("[%s] Shutting down; no further Slack syncs will start (last run: %s)", ME, lastRun);
        cancelled.set(true);
    }

    /**
     * Resolve and run all syncs once.
     *
     * @return final state of each sync, or an empty map if another run is in progress
     * @throws ConfigurationException if a sync references something that does not exist
     * @throws SyncException if the run was aborted
     */
    public Map<String, SyncState> runOnce(List<SyncJob> jobs) {
        if (!runLock.tryLock()) {
            Log.warnf("[%s] A sync run is already in progress (started %s); skipping", ME, lastRun);
            return Map.of();
        }
        try {
            lastRun = Instant.now().toString();
            Log.infof("[%s] Running %d Slack sync(s)", ME, jobs.size());

            SyncPlan plan = syncFactory.createSlackSyncs(jobs);
            Map<String, SyncState> states = syncer.run(plan, botConfig.failFast(), cancelled::get);

            Log.infof("[%s] Finished run: %s", ME, states);
            return states;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Run all syncs now, then keep running them every
     * {@code pdsync.daemon.update-frequency}.
     */
    public void startDaemon(List<SyncJob> jobs) {
        Log.infof("[%s] Starting daemon mode; update frequency %s", ME, botConfig.daemon().updateFrequency());
        runLogged(jobs);
        daemonJobs = jobs;
    }

    public String lastRun() {
        return lastRun;
    }

    @Scheduled(every = "${pdsync.daemon.update-frequency:1m}", concurrentExecution = ConcurrentExecution.SKIP)
    public void scheduledRun() {
        List<SyncJob> jobs = daemonJobs;
        if (jobs == null || cancelled.get()) {
            return;
        }
        try {
            Log.infof("[%s] ⏰ Scheduled: run Slack syncs", ME);
            runLogged(jobs);
        } catch (Throwable t) {
            Log.errorf(t, "[%s] Error running scheduled Slack syncs", ME);
        }
    }

    void runLogged(List<SyncJob> jobs) {
        try {
            runOnce(jobs);
        } catch (SyncException e) {
            Log.errorf("[%s] %s", ME, e.getMessage());
            Log.debugf(e, "[%s] Sync run failed", ME);
        }
    }
}
