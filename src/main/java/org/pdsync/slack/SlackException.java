package org.pdsync.slack;

/**
 * Exception thrown when a Slack Web API call fails.
 * Carries the Slack error code when Slack returned one.
 */
public class SlackException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    static final String MISSING_SCOPE = "missing_scope";

    private final String error;

    public SlackException(String method, String error) {
        super("%s failed: %s".formatted(method, error));
        this.error = error;
    }

    public SlackException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * @return Slack error code (e.g. {@code channel_not_found}), or null
     */
    public String getError() {
        return error;
    }

    /**
     * @return true if the token lacks a scope required by the call
     */
    public boolean isMissingScope() {
        return MISSING_SCOPE.equals(error);
    }
}
