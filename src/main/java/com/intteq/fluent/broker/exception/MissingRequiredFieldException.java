package com.intteq.fluent.broker.exception;

import lombok.Getter;

/**
 * Thrown by a builder's {@code build()} step when a required field was never set.
 */
@Getter
public class MissingRequiredFieldException extends ConfigurationException {

    private final String owner;
    private final String field;

    public MissingRequiredFieldException(String owner, String field) {
        super(owner + ": required field '" + field + "' not set");
        this.owner = owner;
        this.field = field;
    }
}
