package org.pdsync;

/**
 * Updating user group members or the channel topic failed.
 */
public class MutationException extends SyncException {

    private static final long serialVersionUID = 1L;

    public MutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
