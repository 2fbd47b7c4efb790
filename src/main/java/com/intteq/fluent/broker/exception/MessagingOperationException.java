package com.intteq.fluent.broker.exception;

/**
 * Runtime exception used by transport channels to wrap provider SDK exceptions raised while
 * receiving, acknowledging, rejecting or requeuing a message, or while declaring topology.
 */
public class MessagingOperationException extends RuntimeException {

    public MessagingOperationException(String message) {
        super(message);
    }

    public MessagingOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
