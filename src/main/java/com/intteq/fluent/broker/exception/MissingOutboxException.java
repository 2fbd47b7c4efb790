package com.intteq.fluent.broker.exception;

import lombok.Getter;

/**
 * Thrown when an outbox-dependent feature (sweeper, archiver, transaction provider) is
 * requested but no outbox was configured.
 */
@Getter
public class MissingOutboxException extends ConfigurationException {

    private final String feature;

    public MissingOutboxException(String feature) {
        super("Feature '" + feature + "' requires an outbox. Configure one with ProducerBuilder.setOutbox() "
                + "or a transport's useOutbox().");
        this.feature = feature;
    }
}
