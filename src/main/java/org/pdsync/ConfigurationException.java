package org.pdsync;

/**
 * Invalid or unresolvable configuration.
 * Raised before any sync runs; aborts the whole run.
 */
public class ConfigurationException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
