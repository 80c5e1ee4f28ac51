package org.pdsync;

import java.util.List;

import jakarta.inject.Inject;

import org.pdsync.config.SyncBotConfig;
import org.pdsync.config.SyncConfigLoader;
import org.pdsync.sync.SyncJob;

import io.quarkus.logging.Log;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

@QuarkusMain
public class PdSyncMain implements QuarkusApplication {
    static final String ME = "🚀-pdsync";

    @Inject
    SyncBotConfig botConfig;

    @Inject
    SyncConfigLoader configLoader;

    @Inject
    SyncRunner runner;

    public static void main(String... args) {
        Quarkus.run(PdSyncMain.class, args);
    }

    @Override
    public int run(String... args) {
        Log.debugf("[%s] Configuration:\n%s", ME, botConfig.display());

        List<SyncJob> jobs;
        try {
            jobs = configLoader.loadJobs();
        } catch (ConfigurationException e) {
            Log.errorf("[%s] Invalid configuration: %s", ME, e.getMessage());
            return 1;
        }

        if (botConfig.daemon().enabled()) {
            runner.startDaemon(jobs);
            // Reminder: stop can happen elsewhere with Quarkus.asyncExit()
            Quarkus.waitForExit();
            return 0;
        }

        try {
            runner.runOnce(jobs);
        } catch (SyncException e) {
            Log.errorf("[%s] %s", ME, e.getMessage());
            Log.debugf(e, "[%s] Sync run failed", ME);
            return 1;
        }
        return 0;
    }
}
