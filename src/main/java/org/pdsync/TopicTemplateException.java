package org.pdsync;

/**
 * The channel topic template could not be rendered.
 */
public class TopicTemplateException extends SyncException {

    private static final long serialVersionUID = 1L;

    public TopicTemplateException(String message) {
        super(message);
    }

    public TopicTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
