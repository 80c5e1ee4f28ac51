package org.pdsync;

/**
 * A schedule, user or user group could not be found (or fetched).
 */
public class LookupException extends SyncException {

    private static final long serialVersionUID = 1L;

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
