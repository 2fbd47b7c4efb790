package com.intteq.fluent.broker.exception;

import lombok.Getter;

/**
 * Thrown by a resolver asked for an identity that was never registered.
 *
 * <p>This is a runtime condition (a message arrived for, or was sent to, an unconfigured
 * route). Callers should treat it as a configuration defect rather than a transient fault.
 */
@Getter
public class UnknownRouteException extends RuntimeException {

    private final Object identity;

    public UnknownRouteException(String kind, Object identity) {
        super("No " + kind + " route registered for " + identity);
        this.identity = identity;
    }
}
