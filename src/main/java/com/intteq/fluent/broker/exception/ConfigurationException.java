package com.intteq.fluent.broker.exception;

/**
 * Base class of every error raised while the broker configuration is being composed.
 *
 * <p>Configuration errors are fail-fast: they terminate composition immediately and are never
 * retried. No partially built configuration is ever handed to the host.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
