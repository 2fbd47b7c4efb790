package com.intteq.fluent.broker.exception;

/**
 * Raised by a transport producer when a send fails for good: topology could not be prepared, or
 * the publication's retry policy gave up. The cause is the last transport failure.
 */
public class MessagingPublishException extends RuntimeException {

    public MessagingPublishException(String message) {
        super(message);
    }

    public MessagingPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
