package com.intteq.fluent.broker.exception;

import lombok.Getter;

/**
 * Thrown when the same route identity is registered twice while the duplicate route policy is
 * {@code FAIL}.
 */
@Getter
public class DuplicateRouteException extends ConfigurationException {

    private final Object identity;

    public DuplicateRouteException(String kind, Object identity) {
        super("Duplicate " + kind + " route registered for " + identity);
        this.identity = identity;
    }
}
