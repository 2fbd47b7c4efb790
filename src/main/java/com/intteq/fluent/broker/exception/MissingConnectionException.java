package com.intteq.fluent.broker.exception;

import lombok.Getter;

/**
 * Thrown when a transport configurator is applied without a connection ever being set.
 */
@Getter
public class MissingConnectionException extends ConfigurationException {

    private final String transport;

    public MissingConnectionException(String transport) {
        super(transport + " connection configuration is required. Use setConnection() to configure connection settings.");
        this.transport = transport;
    }
}
