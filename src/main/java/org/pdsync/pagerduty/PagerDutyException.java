package org.pdsync.pagerduty;

/**
 * Exception thrown when a PagerDuty API call fails or returns
 * data that can not be used.
 */
public class PagerDutyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PagerDutyException(String message) {
        super(message);
    }

    public PagerDutyException(String message, Throwable cause) {
        super(message, cause);
    }
}
