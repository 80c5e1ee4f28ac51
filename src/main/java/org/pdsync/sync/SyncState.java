package org.pdsync.sync;

/**
 * Progress of a single sync within a run.
 */
public enum SyncState {
    PENDING,
    JOINING_CHANNEL,
    UPDATING_MEMBERSHIP,
    UPDATING_TOPIC,
    DONE,
    FAILED;

    public boolean isFinished() {
        return this == DONE || this == FAILED;
    }
}
